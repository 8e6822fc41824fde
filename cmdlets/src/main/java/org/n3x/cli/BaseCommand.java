package org.n3x.cli;

public abstract class BaseCommand {

    /**
     * @return process exit code
     */
    public abstract int run() throws Exception;
}
