package com.datapatch.json;

import java.util.ServiceLoader;
import java.util.stream.Stream;

/**
 * Entry point for the two JSON jobs around a patch: reading the parse tree a grammar front end
 * emits, and caching transformed patches so they need not be transformed again.
 *
 * <p>Implementations register themselves in
 * {@code META-INF/services/com.datapatch.json.AstJsonProvider}; datapatch-jackson ships one.
 * A host that compiles patches once and runs them on every load would do:</p>
 * <pre>{@code
 * AstJsonProvider json = AstJsonProvider.getProvider();
 * Patch patch = transformer.transformPatch(json.getDeserializer().deserializeParseTree(tree));
 * Files.writeString(cache, json.getSerializer().serialize(patch));
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Name used to pick this provider with {@link #getProvider(String)}, compared ignoring case.
     */
    String getName();

    /**
     * @throws IllegalStateException if no provider is registered
     */
    static AstJsonProvider getProvider() {
        return registered().findFirst().orElseThrow(() -> new IllegalStateException(
            "No patch JSON provider registered; add datapatch-jackson to the classpath"));
    }

    /**
     * @throws IllegalStateException if no registered provider is called {@code name}
     */
    static AstJsonProvider getProvider(String name) {
        return registered()
            .filter(provider -> provider.getName().equalsIgnoreCase(name))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("No patch JSON provider named '" + name + "' is registered"));
    }

    static boolean isProviderAvailable() {
        return registered().findAny().isPresent();
    }

    private static Stream<AstJsonProvider> registered() {
        return ServiceLoader.load(AstJsonProvider.class).stream().map(ServiceLoader.Provider::get);
    }
}
