package org.mutagen.compiler.backend.mutation;

import org.mutagen.compiler.api.CompilationException;
import org.mutagen.compiler.api.CompilerErrorCode;
import org.mutagen.compiler.backend.trace.ITraceService;
import org.mutagen.compiler.diagnostics.CompilerLogger;
import org.mutagen.compiler.ir.IrInstruction;
import org.mutagen.compiler.ir.IrMethod;
import org.mutagen.compiler.ir.IrTypeHandle;
import org.mutagen.compiler.runtime.IRuntimeService;
import org.mutagen.compiler.util.DebugDump;

import java.util.List;
import java.util.Map;

/**
 * Resolves the marker operations of the {@code Mutation} runtime type in a method body:
 * key field loads become constants, placeholder and crypt calls are expanded with the
 * configured processors.
 * <p>
 * Configure the key values and processors before calling {@link #process(IrMethod)} and do
 * not change them while a pass is running. A failed pass may leave the body partially
 * rewritten; wrap the processor in a {@link TransactionalMethodProcessor} if that matters.
 */
public final class MutationProcessor implements IMethodInjectProcessor {

    /** Well-known name of the marker type. */
    public static final String MUTATION_CLASS_NAME = "Mutation";

    private final MarkerCatalog catalog;
    private final ITraceService traceService;
    private Map<MutationField, Integer> keyFieldValues = Map.of();
    private PlaceholderProcessor placeholderProcessor;
    private CryptProcessor cryptProcessor;

    /**
     * Resolves the marker type through the runtime service.
     * @param runtimeService Provider of the {@code Mutation} runtime type.
     * @param traceService Provenance tracer used for placeholder arguments.
     */
    public MutationProcessor(IRuntimeService runtimeService, ITraceService traceService) {
        this(runtimeService.getRuntimeType(MUTATION_CLASS_NAME), traceService);
    }

    /**
     * @param mutationType The marker type handle.
     * @param traceService Provenance tracer used for placeholder arguments.
     */
    public MutationProcessor(IrTypeHandle mutationType, ITraceService traceService) {
        if (mutationType == null) throw new IllegalArgumentException("mutationType must not be null");
        if (traceService == null) throw new IllegalArgumentException("traceService must not be null");
        this.catalog = new MarkerCatalog(mutationType);
        this.traceService = traceService;
    }

    public IrTypeHandle mutationType() {
        return catalog.markerType();
    }

    public Map<MutationField, Integer> getKeyFieldValues() {
        return keyFieldValues;
    }

    /**
     * @param keyFieldValues The key slot values; {@code null} clears them.
     */
    public void setKeyFieldValues(Map<MutationField, Integer> keyFieldValues) {
        this.keyFieldValues = keyFieldValues == null ? Map.of() : Map.copyOf(keyFieldValues);
    }

    public PlaceholderProcessor getPlaceholderProcessor() {
        return placeholderProcessor;
    }

    public void setPlaceholderProcessor(PlaceholderProcessor placeholderProcessor) {
        this.placeholderProcessor = placeholderProcessor;
    }

    public CryptProcessor getCryptProcessor() {
        return cryptProcessor;
    }

    public void setCryptProcessor(CryptProcessor cryptProcessor) {
        this.cryptProcessor = cryptProcessor;
    }

    @Override
    public void process(IrMethod method) throws CompilationException {
        if (method == null) throw new IllegalArgumentException("method must not be null");

        KeyFieldResolver keyResolver = new KeyFieldResolver(keyFieldValues);
        PlaceholderExpander placeholders = new PlaceholderExpander(traceService, placeholderProcessor);
        CryptExpander crypts = new CryptExpander(cryptProcessor);
        List<IrInstruction> body = method.instructions();

        int keys = 0;
        int placeholderCount = 0;
        int cryptCount = 0;

        // The cursor always points at the next original instruction; expanders report
        // where their replacement ended so it is never visited again.
        int i = 0;
        while (i < body.size()) {
            IrInstruction instr = body.get(i);
            MarkerUse use = catalog.classify(instr);

            if (use instanceof MarkerUse.NotAMarker) {
                i++;
            } else if (use instanceof MarkerUse.KeyField keyField) {
                if (!keyResolver.resolve(instr, keyField.field(), method.name())) {
                    throw unexpected(keyField.field().toString(), method);
                }
                CompilerLogger.debug("Resolved " + keyField.field().name() + " in " + method.name() + " at " + i + " -> " + instr);
                keys++;
                i++;
            } else if (use instanceof MarkerUse.PlaceholderCall) {
                i = placeholders.expand(method, instr).nextIndex();
                placeholderCount++;
            } else if (use instanceof MarkerUse.CryptCall) {
                i = crypts.expand(method, instr).nextIndex();
                cryptCount++;
            } else if (use instanceof MarkerUse.Unexpected unexpected) {
                throw unexpected(unexpected.member(), method);
            }
        }

        if (keys + placeholderCount + cryptCount > 0) {
            CompilerLogger.info("Mutation markers resolved in " + method.name() + ": " + keys + " key field(s), "
                    + placeholderCount + " placeholder(s), " + cryptCount + " crypt(s)");
            if (CompilerLogger.isEnabled(CompilerLogger.TRACE)) {
                CompilerLogger.trace(DebugDump.render(method));
            }
        } else {
            CompilerLogger.debug("No mutation markers in " + method.name());
        }
    }

    private static CompilationException unexpected(String member, IrMethod method) {
        return new CompilationException(CompilerErrorCode.UNEXPECTED_MARKER_USE,
                "Unexpected use of mutation member " + member, method.name());
    }
}
