package io.trading.pricestream.query;

import io.trading.pricestream.instrument.InstrumentCatalog;
import io.trading.pricestream.model.Instrument;
import io.trading.pricestream.model.InstrumentType;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read access to the instruments offered to subscribers.
 */
public class InstrumentQueryService {

    private final InstrumentCatalog catalog;

    public InstrumentQueryService(InstrumentCatalog catalog) {
        this.catalog = catalog;
    }

    public List<Instrument> instruments() {
        return List.copyOf(catalog.all());
    }

    public List<Instrument> instruments(InstrumentType type) {
        return catalog.all().stream()
            .filter(instrument -> instrument.type() == type)
            .collect(Collectors.toList());
    }

    public Optional<Instrument> instrument(String symbol) {
        return catalog.find(symbol);
    }
}
