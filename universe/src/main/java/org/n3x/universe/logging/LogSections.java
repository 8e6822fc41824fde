package org.n3x.universe.logging;

import com.google.common.base.Strings;
import org.slf4j.Logger;

/**
 * Banners that split the run log into readable sections
 */
public class LogSections {
    private static final int WIDTH = 64;

    private LogSections() {
        //prevent creating class util instances
    }

    public static void section(Logger log, String title) {
        log.info("");
        log.info(Strings.repeat("=", WIDTH));
        log.info("  {}", title);
        log.info(Strings.repeat("=", WIDTH));
    }

    public static void banner(Logger log, String text) {
        log.info(Strings.repeat("#", WIDTH));
        log.info("# {}", text);
        log.info(Strings.repeat("#", WIDTH));
    }
}
