package trellis.core.engine;

import javax.xml.parsers.FactoryConfigurationError;
import javax.xml.transform.TransformerFactoryConfigurationError;
import java.lang.annotation.AnnotationFormatError;
import java.nio.charset.CoderMalfunctionError;

/**
 * The errors that are never reported as a test failure. They mean the platform itself is in trouble, so they are left
 * to propagate and abort the run.
 */
public final class AbortErrors {

    private AbortErrors() {}

    public static boolean shouldCauseAbort(Throwable throwable) {
        return (throwable instanceof AnnotationFormatError)
                || (throwable instanceof CoderMalfunctionError)
                || (throwable instanceof FactoryConfigurationError)
                || (throwable instanceof LinkageError)
                || (throwable instanceof ThreadDeath)
                || (throwable instanceof TransformerFactoryConfigurationError)
                || (throwable instanceof VirtualMachineError);
    }
}
