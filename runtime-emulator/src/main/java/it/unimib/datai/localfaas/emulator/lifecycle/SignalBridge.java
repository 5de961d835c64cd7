package it.unimib.datai.localfaas.emulator.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Proxy;

/**
 * Installs POSIX signal handlers through {@code sun.misc.Signal} when the running JVM provides it.
 */
public final class SignalBridge {
    private static final Logger log = LoggerFactory.getLogger(SignalBridge.class);

    private SignalBridge() {}

    /**
     * @return true if the handler was installed
     */
    public static boolean install(String signalName, Runnable action) {
        try {
            Class<?> signalClass = Class.forName("sun.misc.Signal");
            Class<?> handlerClass = Class.forName("sun.misc.SignalHandler");
            Object signal = signalClass.getConstructor(String.class).newInstance(signalName);
            Object handler = Proxy.newProxyInstance(SignalBridge.class.getClassLoader(), new Class<?>[]{handlerClass},
                    (proxy, method, args) -> switch (method.getName()) {
                        case "handle" -> {
                            log.info("Received SIG{}", signalName);
                            action.run();
                            yield null;
                        }
                        case "hashCode" -> System.identityHashCode(proxy);
                        case "equals" -> proxy == args[0];
                        case "toString" -> "SignalBridge[SIG" + signalName + "]";
                        default -> null;
                    });
            signalClass.getMethod("handle", signalClass, handlerClass).invoke(null, signal, handler);
            return true;
        } catch (ReflectiveOperationException | IllegalArgumentException | LinkageError e) {
            log.warn("Cannot handle SIG{} on this platform: {}", signalName, e.getMessage());
            return false;
        }
    }
}
