package com.mqparser.json;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Provider interface for syntax tree JSON serialization.
 * Implementations are discovered via Java's ServiceLoader mechanism.
 *
 * <p>To use a provider, add the implementation JAR (e.g., mqparser-jackson)
 * to your classpath. The provider will be automatically discovered.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(parseOk.root());
 * }</pre>
 */
public interface AstJsonProvider {

    /**
     * Returns the serializer for converting nodes to JSON.
     *
     * @return the node JSON serializer
     */
    AstJsonSerializer getSerializer();

    /**
     * Returns the name of this provider (e.g., "Jackson").
     *
     * @return the provider name
     */
    String getName();

    /**
     * Gets the first available AstJsonProvider via ServiceLoader.
     *
     * @return the provider
     * @throws IllegalStateException if no provider is found on the classpath
     */
    static AstJsonProvider getProvider() {
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        Iterator<AstJsonProvider> iterator = loader.iterator();
        if (iterator.hasNext()) {
            return iterator.next();
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. " +
            "Add mqparser-jackson (or another provider) to your dependencies."
        );
    }

    /**
     * Gets an AstJsonProvider by name via ServiceLoader.
     *
     * @param name the provider name, compared ignoring case
     * @return the provider
     * @throws IllegalStateException if no matching provider is found
     */
    static AstJsonProvider getProvider(String name) {
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        for (AstJsonProvider provider : loader) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No AstJsonProvider found with name '" + name + "'");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).iterator().hasNext();
    }
}
