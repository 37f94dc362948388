package trellis.core.event;

import trellis.core.util.ObjectChecker;

/**
 * The place in user code where a test, a scope or a message was declared.
 */
public final class Location {
    private static final String[] FRAMEWORK_PREFIXES = { "trellis.core.", "java.", "jdk.", "sun." };
    public final String className;
    public final String fileName;
    public final int lineNumber;

    private Location(String className, String fileName, int lineNumber) {
        ObjectChecker.assertNonNull(className, "className");
        this.className = className;
        this.fileName = fileName;
        this.lineNumber = lineNumber;
    }

    public static Location of(String className, String fileName, int lineNumber) {
        return new Location(className, fileName, lineNumber);
    }

    /**
     * Returns the location of the innermost stack frame of the current thread that belongs to user code, or null if
     * every frame belongs to the framework or the platform.
     */
    public static Location ofCaller() {
        for (StackTraceElement frame : Thread.currentThread().getStackTrace()) {
            if (!isFrameworkFrame(frame.getClassName())) {
                return new Location(frame.getClassName(), frame.getFileName(), frame.getLineNumber());
            }
        }
        return null;
    }

    private static boolean isFrameworkFrame(String className) {
        for (String prefix : FRAMEWORK_PREFIXES) {
            if (className.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return this.fileName + ":" + this.lineNumber;
    }
}
