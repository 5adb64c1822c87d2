package com.ryuqq.dispatcher.testkit.contract;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.CompletableFuture;

/**
 * A child process whose exit is triggered by the test.
 *
 * <p>Output streams are empty unless a stdout is supplied. {@link #onExit()} completes when
 * {@link #exit(int)} is called.</p>
 *
 * @author Dispatcher Team
 * @since 1.0.0
 */
public class ControlledProcess extends Process {

    private final CompletableFuture<Process> exited = new CompletableFuture<>();
    private final InputStream stdout;
    private volatile int exitCode = -1;

    public ControlledProcess() {
        this(new ByteArrayInputStream(new byte[0]));
    }

    /**
     * @param stdout stream returned by {@link #getInputStream()}
     */
    public ControlledProcess(InputStream stdout) {
        this.stdout = stdout;
    }

    /**
     * Terminates the process with the given code.
     *
     * @param code exit code
     */
    public void exit(int code) {
        exitCode = code;
        exited.complete(this);
    }

    @Override
    public CompletableFuture<Process> onExit() {
        return exited;
    }

    @Override
    public OutputStream getOutputStream() {
        return new ByteArrayOutputStream();
    }

    @Override
    public InputStream getInputStream() {
        return stdout;
    }

    @Override
    public InputStream getErrorStream() {
        return new ByteArrayInputStream(new byte[0]);
    }

    @Override
    public int waitFor() {
        exited.join();
        return exitCode;
    }

    @Override
    public int exitValue() {
        if (!exited.isDone()) {
            throw new IllegalThreadStateException("process has not exited");
        }
        return exitCode;
    }

    @Override
    public void destroy() {
        exit(143);
    }
}
