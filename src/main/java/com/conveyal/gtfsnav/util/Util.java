package com.conveyal.gtfsnav.util;

public abstract class Util {

    public static String human (int n) {
        if (n >= 1000000000) return String.format("%.1fG", n/1000000000.0);
        if (n >= 1000000) return String.format("%.1fM", n/1000000.0);
        if (n >= 1000) return String.format("%dk", n/1000);
        else return String.format("%d", n);
    }

    /** Format a byte count for progress messages, e.g. "12.3 MB". */
    public static String humanBytes (long bytes) {
        if (bytes >= 1L << 30) return String.format("%.1f GB", bytes / (double) (1L << 30));
        if (bytes >= 1L << 20) return String.format("%.1f MB", bytes / (double) (1L << 20));
        if (bytes >= 1L << 10) return String.format("%.1f kB", bytes / (double) (1L << 10));
        return String.format("%d bytes", bytes);
    }

}
