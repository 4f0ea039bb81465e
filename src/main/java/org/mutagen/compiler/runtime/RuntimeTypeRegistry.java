package org.mutagen.compiler.runtime;

import org.mutagen.compiler.ir.IrTypeHandle;

import java.util.HashMap;
import java.util.Map;

/**
 * In-memory registry of runtime types.
 */
public final class RuntimeTypeRegistry implements IRuntimeService {

    private final Map<String, IrTypeHandle> types = new HashMap<>();

    /**
     * Creates and registers a new handle.
     * @param name The well-known name.
     * @return The new handle.
     */
    public IrTypeHandle register(String name) {
        return register(new IrTypeHandle(name));
    }

    /**
     * Registers an existing handle under its name, replacing any previous registration.
     * @param handle The handle to register.
     * @return The registered handle.
     */
    public IrTypeHandle register(IrTypeHandle handle) {
        types.put(handle.name(), handle);
        return handle;
    }

    @Override
    public IrTypeHandle getRuntimeType(String name) {
        IrTypeHandle handle = types.get(name);
        if (handle == null) {
            throw new IllegalStateException("Runtime type '" + name + "' is not registered.");
        }
        return handle;
    }
}
