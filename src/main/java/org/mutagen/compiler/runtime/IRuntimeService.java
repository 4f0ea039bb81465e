package org.mutagen.compiler.runtime;

import org.mutagen.compiler.ir.IrTypeHandle;

/**
 * Resolves the well-known runtime types that generated code references symbolically.
 */
public interface IRuntimeService {

    /**
     * Resolves a runtime type by its well-known name.
     * @param name The name of the runtime type.
     * @return The handle of the runtime type.
     * @throws IllegalStateException if no type with this name is known.
     */
    IrTypeHandle getRuntimeType(String name);
}
