package com.stackfit.engine;

public class ProcessResult {
    public final int exitCode;
    public final String stdout;
    public final String stderr;
    public final boolean timedOut;

    public ProcessResult(int exitCode, String stdout, String stderr, boolean timedOut) {
        this.exitCode = exitCode;
        this.stdout = stdout;
        this.stderr = stderr;
        this.timedOut = timedOut;
    }

    public static ProcessResult timeout(String stdout, String stderr) {
        return new ProcessResult(-1, stdout, stderr, true);
    }
}
