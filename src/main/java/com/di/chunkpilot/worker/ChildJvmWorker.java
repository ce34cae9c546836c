package com.di.chunkpilot.worker;

import com.di.chunkpilot.util.SerializationSupport;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * One child JVM running {@link IsolatedWorkerMain}. Not thread-safe: a worker serves one batch
 * at a time and is handed between pool threads through a queue.
 */
@Slf4j
public final class ChildJvmWorker implements AutoCloseable {

    private final Process process;
    private final ObjectOutputStream out;
    private final ObjectInputStream in;
    private volatile boolean broken;

    private ChildJvmWorker(Process process, ObjectOutputStream out, ObjectInputStream in) {
        this.process = process;
        this.out = out;
        this.in = in;
    }

    /**
     * Starts a child JVM on this JVM's classpath and waits for its ready handshake.
     */
    public static ChildJvmWorker launch() throws IOException {
        String javaBin = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        ProcessBuilder builder = new ProcessBuilder(
                javaBin, "-cp", System.getProperty("java.class.path"), IsolatedWorkerMain.class.getName());
        builder.redirectError(ProcessBuilder.Redirect.INHERIT);
        Process process = builder.start();
        try {
            ObjectOutputStream out = new ObjectOutputStream(new BufferedOutputStream(process.getOutputStream()));
            out.flush();
            ObjectInputStream in = new ObjectInputStream(new BufferedInputStream(process.getInputStream()));
            Object hello = in.readObject();
            if (!IsolatedWorkerMain.READY.equals(hello)) {
                throw new IOException("Unexpected handshake from child worker: " + hello);
            }
            log.debug("[WORKER] child JVM pid={} ready", process.pid());
            return new ChildJvmWorker(process, out, in);
        } catch (IOException | ClassNotFoundException | RuntimeException e) {
            process.destroyForcibly();
            throw e instanceof IOException io ? io : new IOException("Child worker failed to start", e);
        }
    }

    @SuppressWarnings("unchecked")
    <R> List<R> execute(byte[] request) throws IOException {
        out.writeObject(request);
        out.flush();
        out.reset();
        byte[] reply;
        try {
            reply = (byte[]) in.readObject();
        } catch (ClassNotFoundException e) {
            throw new IOException("Malformed reply from child worker", e);
        }
        BatchResponse response = SerializationSupport.fromBytes(reply);
        if (response.failed()) {
            throw new IsolatedWorkerException(response.errorType(), response.errorMessage());
        }
        return (List<R>) new ArrayList<>(response.results());
    }

    public long pid() {
        return process.pid();
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    /** Alive and never destroyed; a destroyed child may still be exiting. */
    public boolean isUsable() {
        return !broken && process.isAlive();
    }

    /** Asks the child to exit and waits briefly; kills it if it does not comply. */
    @Override
    public void close() {
        try {
            out.writeObject(IsolatedWorkerMain.SHUTDOWN);
            out.flush();
            out.close();
            if (!process.waitFor(2, TimeUnit.SECONDS)) {
                process.destroyForcibly();
            }
        } catch (IOException e) {
            log.debug("[WORKER] child JVM pid={} already gone: {}", process.pid(), e.getMessage());
            process.destroyForcibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
    }

    public void destroy() {
        broken = true;
        process.destroyForcibly();
    }
}
