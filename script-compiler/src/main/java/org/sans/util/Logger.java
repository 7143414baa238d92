package org.sans.util;

import org.sans.compiler.errors.CompilationError;

import java.util.HashMap;
import java.util.Map;

/** Logging class which can output nicely indented strings.
 * The logger wraps an IndentStream, and thus provides the capability
 * to output nicely indented hierarchical visualizations. */
public class Logger {
    private final Map<Class<?>, Integer> loggingLevel = new HashMap<>();
    private final IndentStream debugStream;
    private final IIndentStream noStream;

    /** There is only one instance of the logger for the whole program. */
    public static final Logger INSTANCE = new Logger();

    private Logger() {
        this.debugStream = new IndentStream(System.err);
        this.noStream = new NullIndentStream();
    }

    /** Get the logging stream for messages below this logging level.
     * @param clazz   Class which does the logging.
     * @param level   Level of message that is being logged.
     * @return        A stream where the message can be appended. */
    public IIndentStream belowLevel(Class<?> clazz, int level) {
        int debugLevel = this.getLoggingLevel(clazz);
        if (debugLevel >= level)
            return this.debugStream;
        return this.noStream;
    }

    /** Get the logging stream for messages below this logging level.
     * @param module  Module which does the logging.
     * @param level   Level of message that is being logged. */
    public IIndentStream belowLevel(IWritesLogs module, int level) {
        return this.belowLevel(module.getClass(), level);
    }

    /** Debug level is controlled per class and can be changed dynamically.
     * @return Previous logging level for this class. */
    public int setLoggingLevel(Class<?> clazz, int level) {
        int previous = this.loggingLevel.getOrDefault(clazz, 0);
        this.loggingLevel.put(clazz, level);
        return previous;
    }

    static final String root = "org.sans";

    /* Packages containing classes that can be instrumented with logging,
     * relative to root. */
    static final String[] packages = new String[] {
            "compiler",
            "compiler.frontend",
            "compiler.frontend.legacy",
            "compiler.frontend.script",
            "compiler.validator",
            "executor",
            "executor.operators",
    };

    Class<?> locateClass(String className) {
        for (String pack: packages) {
            String path = root + "." + pack + "." + className;
            try {
                return Class.forName(path);
            } catch (ClassNotFoundException e) {
                // try the next package
            }
        }
        throw new CompilationError("Class " + className + " not found for setting up logging");
    }

    /** Set the logging level of a class given by its simple name. */
    @SuppressWarnings("UnusedReturnValue")
    public int setLoggingLevel(String className, int level) {
        Class<?> clazz = this.locateClass(className);
        return this.setLoggingLevel(clazz, level);
    }

    public <T> int getLoggingLevel(Class<T> clazz) {
        if (this.loggingLevel.isEmpty())
            return 0;
        for (var e: this.loggingLevel.entrySet()) {
            Class<?> c = e.getKey();
            if (c.isAssignableFrom(clazz))
                return e.getValue();
        }
        return 0;
    }

    /** Where logging should be redirected.
     * Notice that the indentation is *not* reset when the stream is changed. */
    public Appendable setDebugStream(Appendable writer) {
        return this.debugStream.setOutputStream(writer);
    }
}
