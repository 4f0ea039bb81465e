package org.mutagen.compiler.util;

import org.mutagen.compiler.diagnostics.CompilerLogger;
import org.mutagen.compiler.ir.IrBranchTarget;
import org.mutagen.compiler.ir.IrInstruction;
import org.mutagen.compiler.ir.IrMethod;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Utility class for rendering and dumping method bodies while debugging passes.
 */
public final class DebugDump {

    private DebugDump() {}

    /**
     * Renders a method body as one instruction per line. Branch operands are shown
     * as the index of their target.
     * @param method The method to render.
     * @return The listing.
     */
    public static String render(IrMethod method) {
        List<IrInstruction> body = method.instructions();
        Map<IrInstruction, Integer> positions = new IdentityHashMap<>();
        for (int i = 0; i < body.size(); i++) positions.put(body.get(i), i);

        StringBuilder sb = new StringBuilder();
        sb.append(".method ").append(method.name()).append('\n');
        for (int i = 0; i < body.size(); i++) {
            IrInstruction ins = body.get(i);
            sb.append(String.format("%4d: ", i)).append(ins.opcode().name());
            if (ins.operand() instanceof IrBranchTarget bt) {
                Integer target = positions.get(bt.target());
                sb.append(" @").append(target != null ? target.toString() : "?");
            } else if (ins.operand() != null) {
                sb.append(' ').append(ins.operand());
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Dumps a method body to {@code <root>/<method>/<phase>_ir.txt}.
     * A failed dump is logged and does not affect the pass.
     * @param root The dump root directory.
     * @param phase The name of the phase, used for the file name.
     * @param method The method to dump.
     */
    public static void dumpMethod(Path root, String phase, IrMethod method) {
        Path dir = root.resolve(sanitize(method.name()));
        try {
            Files.createDirectories(dir);
            Files.writeString(dir.resolve(phase + "_ir.txt"), render(method));
        } catch (IOException e) {
            CompilerLogger.warn("Could not dump method " + method.name() + " to " + dir + ": " + e.getMessage());
        }
    }

    private static String sanitize(String s) { return s.replaceAll("[^A-Za-z0-9_.-]", "_"); }
}
