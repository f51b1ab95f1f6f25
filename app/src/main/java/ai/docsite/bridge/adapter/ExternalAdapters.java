package ai.docsite.bridge.adapter;

import ai.docsite.bridge.registry.AdapterKind;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup of the adapter implementing each {@link AdapterKind}.
 */
public final class ExternalAdapters {

    private final Map<AdapterKind, ExternalAdapter> adapters = new EnumMap<>(AdapterKind.class);

    public ExternalAdapters(List<ExternalAdapter> adapters) {
        for (ExternalAdapter adapter : adapters) {
            this.adapters.put(adapter.kind(), adapter);
        }
    }

    public static ExternalAdapters defaults() {
        return new ExternalAdapters(List.of(new MkDocsNavAdapter(), new DocusaurusSidebarAdapter(), new ConfluencePageAdapter()));
    }

    public ExternalAdapter forKind(AdapterKind kind) {
        ExternalAdapter adapter = adapters.get(kind);
        if (adapter == null) {
            throw new IllegalArgumentException("No adapter registered for " + kind.label());
        }
        return adapter;
    }
}
