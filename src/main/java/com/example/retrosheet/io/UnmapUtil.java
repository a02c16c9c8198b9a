package com.example.retrosheet.io;

import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;

/**
 * Releases a chunk mapping before the next chunk of an intermediate file is mapped.
 * The mapping is otherwise held until the buffer is garbage collected, which keeps
 * large simple files pinned in the address space for the whole entity pass.
 */
@Slf4j
final class UnmapUtil {

    private static final Method INVOKE_CLEANER;
    private static final Object UNSAFE;

    static {
        Method invokeCleaner = null;
        Object unsafe = null;
        try {
            Class<?> unsafeClass = Class.forName("sun.misc.Unsafe");
            Field f = unsafeClass.getDeclaredField("theUnsafe");
            f.setAccessible(true);
            unsafe = f.get(null);
            invokeCleaner = unsafeClass.getMethod("invokeCleaner", ByteBuffer.class);
        } catch (ReflectiveOperationException | RuntimeException e) {
            log.debug("sun.misc.Unsafe.invokeCleaner unavailable, mappings are released by GC: {}", e.getMessage());
        }
        INVOKE_CLEANER = invokeCleaner;
        UNSAFE = unsafe;
    }

    private UnmapUtil() {}

    static void unmap(MappedByteBuffer buffer) {
        if (buffer == null || INVOKE_CLEANER == null) return;
        try {
            INVOKE_CLEANER.invoke(UNSAFE, buffer);
        } catch (ReflectiveOperationException | RuntimeException e) {
            log.warn("Unable to unmap chunk ({}); it will be reclaimed by GC eventually.", e.getMessage());
        }
    }
}
