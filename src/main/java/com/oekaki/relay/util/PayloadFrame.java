package com.oekaki.relay.util;

import java.util.ArrayList;
import java.util.List;

/** Helpers for the client's framed payload: a 4-byte tag followed by the image-bin bytes. */
public final class PayloadFrame {
    private PayloadFrame() {}

    /** Tag every framed payload starts with. */
    public static final int[] MAGIC = {0x23, 0x52, 0xFF, 0xAC};

    public static final int HEADER_LENGTH = MAGIC.length;

    /** True if the first four entries equal {@link #MAGIC}. */
    public static boolean hasMagic(List<Integer> payload) {
        if (payload == null || payload.size() < HEADER_LENGTH) {
            return false;
        }
        for (int i = 0; i < HEADER_LENGTH; i++) {
            Integer b = payload.get(i);
            if (b == null || b != MAGIC[i]) {
                return false;
            }
        }
        return true;
    }

    /** True if every entry is a non-null value in 0..255. */
    public static boolean allBytes(List<Integer> payload) {
        for (Integer b : payload) {
            if (b == null || b < 0 || b > 0xFF) {
                return false;
            }
        }
        return true;
    }

    /** Body bytes after the header. Caller must have checked {@link #hasMagic}. */
    public static byte[] unframe(List<Integer> payload) {
        byte[] body = new byte[payload.size() - HEADER_LENGTH];
        for (int i = 0; i < body.length; i++) {
            body[i] = (byte) payload.get(i + HEADER_LENGTH).intValue();
        }
        return body;
    }

    /** Unsigned int view of stored bytes, as the client expects them on read. */
    public static List<Integer> toUnsignedList(byte[] bytes) {
        List<Integer> out = new ArrayList<>(bytes.length);
        for (byte b : bytes) {
            out.add(b & 0xFF);
        }
        return out;
    }
}
