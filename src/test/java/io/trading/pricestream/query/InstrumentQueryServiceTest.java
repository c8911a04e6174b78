package io.trading.pricestream.query;

import io.trading.pricestream.instrument.InstrumentCatalog;
import io.trading.pricestream.model.Instrument;
import io.trading.pricestream.model.InstrumentType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InstrumentQueryServiceTest {

    private final Instrument eurusd = new Instrument("EURUSD", "Euro/US Dollar", InstrumentType.FOREX);
    private final Instrument btcusd = new Instrument("BTCUSD", "Bitcoin/US Dollar", InstrumentType.CRYPTO);
    private final InstrumentQueryService service =
        new InstrumentQueryService(new InstrumentCatalog(List.of(eurusd, btcusd)));

    @Test
    void testListsInConfigurationOrder() {
        assertEquals(List.of(eurusd, btcusd), service.instruments());
        assertEquals(List.of(btcusd), service.instruments(InstrumentType.CRYPTO));
    }

    @Test
    void testLookupIsCaseInsensitive() {
        assertEquals(eurusd, service.instrument("eurusd").orElseThrow());
        assertTrue(service.instrument("USDJPY").isEmpty());
    }

    @Test
    void testDuplicateInstrumentsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new InstrumentCatalog(List.of(eurusd, eurusd)));
    }
}
