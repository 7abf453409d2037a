package ca.spottedleaf.lockguardedqueue.util;

public final class Validate {

    /**
     * Throws a {@link NullPointerException} with the specified message if the object is {@code null}.
     * @return the object
     */
    public static <T> T notNull(final T obj, final String msg) {
        if (obj == null) {
            throw new NullPointerException(msg);
        }
        return obj;
    }

    private Validate() {
        throw new RuntimeException();
    }
}
