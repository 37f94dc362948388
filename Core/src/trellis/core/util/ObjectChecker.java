package trellis.core.util;

/**
 * Precondition checks shared by the public entry points. Every check runs before any state is touched.
 */
public final class ObjectChecker {

    private ObjectChecker() {}

    public static void assertNonNull(Object object, String name) {
        if (object == null) {
            throw new NullPointerException(name + " was null");
        }
    }

    public static void assertNonNull(Object... objects) {
        for (int i = 0; i < objects.length; i++) {
            if (objects[i] == null) {
                throw new NullPointerException("object must be non-null: violated by object at index " + i);
            }
        }
    }

    /**
     * Throws if the array itself or any of its elements is null.
     *
     * @param elements The array to check.
     * @param name The name reported for the array.
     */
    public static void assertNoNullElements(Object[] elements, String name) {
        assertNonNull(elements, name);
        for (Object element : elements) {
            if (element == null) {
                throw new NullPointerException("an element of " + name + " was null");
            }
        }
    }

    public static void assertNonNegative(long value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must be non-negative but was: " + value);
        }
    }
}
