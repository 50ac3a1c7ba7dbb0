package org.vira.compiler.frontend.preprocessor;

import org.vira.compiler.frontend.preprocessor.features.include.IncludeDirectiveHandler;
import org.vira.compiler.frontend.preprocessor.features.macro.DefineDirectiveHandler;
import org.vira.compiler.frontend.preprocessor.features.macro.UndefDirectiveHandler;
import org.vira.compiler.frontend.preprocessor.features.passthrough.PassThroughDirectiveHandler;

import java.util.HashMap;
import java.util.Map;

/**
 * Registry for preprocessor directive handlers.
 * Maps directive keywords (e.g., "include", "define") to their handlers. Keywords are case-sensitive.
 */
public class PreProcessorDirectiveRegistry {

    private final Map<String, IPreProcessorDirectiveHandler> handlers = new HashMap<>();
    private final IPreProcessorDirectiveHandler fallback;

    /**
     * @param fallback The handler for directives without a registered keyword.
     */
    public PreProcessorDirectiveRegistry(IPreProcessorDirectiveHandler fallback) {
        this.fallback = fallback;
    }

    /**
     * Registers a handler for a directive keyword.
     * @param keyword The keyword following {@code #}.
     * @param handler The handler for this directive.
     */
    public void register(String keyword, IPreProcessorDirectiveHandler handler) {
        handlers.put(keyword, handler);
    }

    /**
     * Looks up the handler for a directive keyword.
     * @param keyword The keyword.
     * @return The registered handler, or the fallback handler if none is registered.
     */
    public IPreProcessorDirectiveHandler get(String keyword) {
        return handlers.getOrDefault(keyword, fallback);
    }

    /**
     * Creates a registry with all built-in handlers. {@code ifdef} and {@code ifndef} are
     * registered as pass-through: conditional compilation is not evaluated.
     * @return A new registry instance.
     */
    public static PreProcessorDirectiveRegistry initialize() {
        PassThroughDirectiveHandler passThrough = new PassThroughDirectiveHandler();
        PreProcessorDirectiveRegistry registry = new PreProcessorDirectiveRegistry(passThrough);
        registry.register("include", new IncludeDirectiveHandler());
        registry.register("define", new DefineDirectiveHandler());
        registry.register("undef", new UndefDirectiveHandler());
        registry.register("ifdef", passThrough);
        registry.register("ifndef", passThrough);
        return registry;
    }
}
