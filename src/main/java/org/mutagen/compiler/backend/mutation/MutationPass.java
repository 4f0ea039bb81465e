package org.mutagen.compiler.backend.mutation;

import com.typesafe.config.Config;
import org.mutagen.compiler.api.CompilationException;
import org.mutagen.compiler.backend.trace.ITraceService;
import org.mutagen.compiler.diagnostics.CompilerLogger;
import org.mutagen.compiler.ir.IrMethod;
import org.mutagen.compiler.runtime.IRuntimeService;
import org.mutagen.compiler.util.DebugDump;
import org.mutagen.config.MutationOptions;

import java.util.Collection;

/**
 * Entry point that assembles the mutation pass from its options and collaborators
 * and applies it to methods.
 */
public final class MutationPass {

    private final MutationOptions options;
    private final MutationProcessor mutationProcessor;
    private final IMethodInjectProcessor processor;

    /**
     * @param options The pass options.
     * @param runtimeService Provider of the marker runtime type.
     * @param traceService Provenance tracer for placeholder arguments.
     * @param placeholderProcessor Transform for placeholder calls, may be null if none are expected.
     * @param cryptProcessor Transform for crypt calls, may be null if none are expected.
     */
    public MutationPass(MutationOptions options,
                        IRuntimeService runtimeService,
                        ITraceService traceService,
                        PlaceholderProcessor placeholderProcessor,
                        CryptProcessor cryptProcessor) {
        this.options = options;
        CompilerLogger.setLevel(options.verbosity());

        this.mutationProcessor = new MutationProcessor(runtimeService.getRuntimeType(options.markerTypeName()), traceService);
        mutationProcessor.setKeyFieldValues(options.keyFieldValues());
        mutationProcessor.setPlaceholderProcessor(placeholderProcessor);
        mutationProcessor.setCryptProcessor(cryptProcessor);

        this.processor = options.transactional()
                ? new TransactionalMethodProcessor(mutationProcessor)
                : mutationProcessor;
    }

    /**
     * Builds a pass from a resolved configuration.
     * @see MutationOptions#fromConfig(Config)
     */
    public static MutationPass fromConfig(Config config,
                                          IRuntimeService runtimeService,
                                          ITraceService traceService,
                                          PlaceholderProcessor placeholderProcessor,
                                          CryptProcessor cryptProcessor) {
        return new MutationPass(MutationOptions.fromConfig(config), runtimeService, traceService, placeholderProcessor, cryptProcessor);
    }

    public MutationOptions options() {
        return options;
    }

    /**
     * @return The configured marker processor, without the transactional wrapper.
     */
    public MutationProcessor mutationProcessor() {
        return mutationProcessor;
    }

    /**
     * Resolves all mutation markers of one method.
     * @param method The method to rewrite.
     * @throws CompilationException if a marker cannot be resolved.
     */
    public void run(IrMethod method) throws CompilationException {
        if (options.dumpEnabled()) DebugDump.dumpMethod(options.dumpDirectory(), "before_mutation", method);
        processor.process(method);
        if (options.dumpEnabled()) DebugDump.dumpMethod(options.dumpDirectory(), "after_mutation", method);
    }

    /**
     * Resolves all mutation markers of several methods, stopping at the first failure.
     * @param methods The methods to rewrite, in order.
     * @throws CompilationException for the first method that fails.
     */
    public void runAll(Collection<IrMethod> methods) throws CompilationException {
        for (IrMethod method : methods) {
            try {
                run(method);
            } catch (CompilationException e) {
                CompilerLogger.error("Mutation pass failed for method " + method.name() + ": " + e.getMessage());
                throw e;
            }
        }
    }
}
