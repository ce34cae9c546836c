package com.di.chunkpilot.util;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.UncheckedIOException;

/**
 * Java-serialization helpers for the worker isolation boundary. Everything that crosses
 * into an isolated worker (the function, the batch, the results) goes through here.
 */
public final class SerializationSupport {

    private SerializationSupport() {}

    public static byte[] toBytes(Object value) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(256);
        try (ObjectOutputStream out = new ObjectOutputStream(bytes)) {
            out.writeObject(value);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bytes.toByteArray();
    }

    @SuppressWarnings("unchecked")
    public static <T> T fromBytes(byte[] data) {
        try (ObjectInputStream in = new ObjectInputStream(new ByteArrayInputStream(data))) {
            return (T) in.readObject();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("Class not resolvable across isolation boundary: " + e.getMessage(), e);
        }
    }

    /** Serializes and deserializes {@code value}, returning an independent copy. */
    public static <T> T roundTrip(T value) {
        return fromBytes(toBytes(value));
    }
}
