package com.ciro.jtemplatex.thread;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * El único hilo autorizado a tocar vistas y a llamar syncFlush/forceFlush.
 * <p>
 * No hay toolkit real detrás: el hilo se designa con {@link #bindToCurrentThread()}.
 * En modo debug una violación lanza {@link IllegalStateException}; en producción se
 * loguea y la operación se salta.
 */
public final class UiThread {

    private static final Logger log = LoggerFactory.getLogger(UiThread.class);

    private volatile Thread thread;
    private final boolean strict;

    private UiThread(Thread thread, boolean strict) {
        this.thread = thread;
        this.strict = strict;
    }

    /** El hilo que llama pasa a ser el hilo UI. */
    public static UiThread bindToCurrentThread(boolean strict) {
        return new UiThread(Thread.currentThread(), strict);
    }

    public static UiThread of(Thread thread, boolean strict) {
        return new UiThread(thread, strict);
    }

    /** Re-designa el hilo (p.ej. cuando el host arranca su loop en otro hilo). */
    public void rebind(Thread t) {
        this.thread = t;
    }

    public boolean isCurrent() {
        return Thread.currentThread() == thread;
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * @return true si se puede continuar con {@code operation}
     */
    public boolean check(String operation) {
        if (isCurrent()) return true;
        String msg = "'" + operation + "' fuera del hilo UI (" + Thread.currentThread().getName()
                + ", esperado " + thread.getName() + ")";
        if (strict) throw new IllegalStateException(msg);
        log.error("🛡️ {} - se ignora", msg);
        return false;
    }
}
