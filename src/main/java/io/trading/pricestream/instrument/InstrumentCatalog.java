package io.trading.pricestream.instrument;

import io.trading.pricestream.model.Instrument;
import io.trading.pricestream.model.Symbols;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only lookup of the instruments offered to subscribers.
 * Built once from configuration and passed to the components that need it.
 */
public final class InstrumentCatalog {

    private final Map<String, Instrument> bySymbol;

    public InstrumentCatalog(Collection<Instrument> instruments) {
        Map<String, Instrument> map = new LinkedHashMap<>();
        for (Instrument instrument : instruments) {
            if (map.putIfAbsent(instrument.symbol(), instrument) != null) {
                throw new IllegalArgumentException("Duplicate instrument: " + instrument.symbol());
            }
        }
        this.bySymbol = Collections.unmodifiableMap(map);
    }

    /**
     * All instruments in configuration order.
     */
    public Collection<Instrument> all() {
        return bySymbol.values();
    }

    public Optional<Instrument> find(String symbol) {
        return Optional.ofNullable(bySymbol.get(Symbols.normalize(symbol)));
    }

    public boolean contains(String symbol) {
        return bySymbol.containsKey(Symbols.normalize(symbol));
    }

    public int size() {
        return bySymbol.size();
    }
}
