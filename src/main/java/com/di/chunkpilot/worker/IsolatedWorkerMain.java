package com.di.chunkpilot.worker;

import com.di.chunkpilot.util.SerializationSupport;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.EOFException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.PrintStream;

/**
 * Entry point of a child JVM worker.
 *
 * <p>Protocol over stdin/stdout object streams: the child announces {@link #READY}, then
 * answers every {@code byte[]} request (a serialized {@link BatchRequest}) with a
 * {@code byte[]} serialized {@link BatchResponse}. {@link #SHUTDOWN} or end of input ends the
 * process. Stdout is reserved for the protocol; anything printed by user code goes to stderr.
 */
public final class IsolatedWorkerMain {

    static final String READY = "CHUNKPILOT-WORKER-READY";
    static final String SHUTDOWN = "CHUNKPILOT-WORKER-SHUTDOWN";

    private IsolatedWorkerMain() {}

    public static void main(String[] args) throws Exception {
        PrintStream channel = System.out;
        System.setOut(System.err);

        ObjectOutputStream out = new ObjectOutputStream(new BufferedOutputStream(channel));
        out.writeObject(READY);
        out.flush();
        ObjectInputStream in = new ObjectInputStream(new BufferedInputStream(System.in));

        while (true) {
            Object message;
            try {
                message = in.readObject();
            } catch (EOFException e) {
                break;
            }
            if (SHUTDOWN.equals(message)) {
                break;
            }
            out.writeObject(handle((byte[]) message));
            out.flush();
            out.reset();
        }
        out.close();
    }

    static byte[] handle(byte[] request) {
        BatchResponse response;
        try {
            BatchRequest batch = SerializationSupport.fromBytes(request);
            response = BatchResponse.success(batch.apply());
        } catch (Exception e) {
            response = BatchResponse.failure(e);
        }
        try {
            return SerializationSupport.toBytes(response);
        } catch (RuntimeException e) {
            return SerializationSupport.toBytes(BatchResponse.failure(e));
        }
    }
}
