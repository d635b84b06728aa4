package com.mmbrief.indicator;

import com.mmbrief.data.SyntheticProvider;
import com.mmbrief.model.IndicatorRow;
import com.mmbrief.model.IndicatorSeries;
import com.mmbrief.model.PriceBar;
import com.mmbrief.model.PriceSeries;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndicatorEngineTest {
    private static final double EPS = 1e-9;

    private final IndicatorEngine engine = new IndicatorEngine();

    @Test
    void smaShouldBeUndefinedUntilWindowIsFull() {
        double[] out = IndicatorEngine.sma(new double[]{1, 2, 3, 4, 5}, 3);

        assertTrue(Double.isNaN(out[0]));
        assertTrue(Double.isNaN(out[1]));
        assertEquals(2.0, out[2], EPS);
        assertEquals(3.0, out[3], EPS);
        assertEquals(4.0, out[4], EPS);
    }

    @Test
    void sampleStdShouldUseNMinusOne() {
        double[] out = IndicatorEngine.sampleStd(new double[]{2, 4, 4, 4, 5, 5, 7, 9}, 8);

        // population std is 2.0; sample std is sqrt(32/7)
        assertEquals(Math.sqrt(32.0 / 7.0), out[7], EPS);
        assertTrue(Double.isNaN(out[6]));
    }

    @Test
    void rsiShouldBeHundredWhenThereAreNoLosses() {
        double[] closes = new double[20];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = 10.0 + i;
        }

        double[] rsi = IndicatorEngine.rsi(closes, 14);

        assertTrue(Double.isNaN(rsi[12]));
        assertEquals(100.0, rsi[13], EPS);
        assertEquals(100.0, rsi[19], EPS);
    }

    @Test
    void rsiShouldCountFirstDifferenceAsZero() {
        double[] closes = new double[15];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = i % 2 == 0 ? 10.0 : 11.0;
        }

        double[] rsi = IndicatorEngine.rsi(closes, 14);

        // window at index 13: seven +1 moves, six -1 moves, one zero seed
        assertEquals(100.0 - 100.0 / (1.0 + 7.0 / 6.0), rsi[13], EPS);
        // window at index 14: seven gains and seven losses
        assertEquals(50.0, rsi[14], EPS);
    }

    @Test
    void emaShouldSeedFromFirstValue() {
        double[] out = IndicatorEngine.ema(new double[]{1, 2, 3}, 3);

        assertEquals(1.0, out[0], EPS);
        assertEquals(1.5, out[1], EPS);
        assertEquals(2.25, out[2], EPS);
    }

    @Test
    void trueRangeShouldIncludeGapsFromPreviousClose() {
        double[] highs = {11, 15, 12};
        double[] lows = {9, 13, 8};
        double[] closes = {10, 14, 9};

        double[] tr = IndicatorEngine.trueRange(highs, lows, closes);

        assertEquals(2.0, tr[0], EPS);
        assertEquals(5.0, tr[1], EPS);
        assertEquals(6.0, tr[2], EPS);
    }

    @Test
    void computeShouldAlignRowsAndRespectWarmUp() {
        PriceSeries series = series(250);

        IndicatorSeries indicators = engine.compute(series);

        assertEquals(250, indicators.size());
        for (int i = 0; i < series.size(); i++) {
            assertEquals(series.get(i), indicators.get(i).bar);
        }
        assertFalse(IndicatorRow.isDefined(indicators.get(198).sma200));
        assertTrue(IndicatorRow.isDefined(indicators.get(199).sma200));
        assertFalse(IndicatorRow.isDefined(indicators.get(48).sma50));
        assertTrue(IndicatorRow.isDefined(indicators.get(49).sma50));
        assertFalse(IndicatorRow.isDefined(indicators.get(18).bbUpper));
        assertTrue(IndicatorRow.isDefined(indicators.get(19).bbBandwidth));
        assertFalse(IndicatorRow.isDefined(indicators.get(12).atr14));
        assertTrue(IndicatorRow.isDefined(indicators.get(13).atr14));
        assertTrue(IndicatorRow.isDefined(indicators.get(0).macd));
        assertTrue(IndicatorRow.isDefined(indicators.get(0).macdSignal));
    }

    @Test
    void computeShouldDeriveBandsAndHistogramConsistently() {
        IndicatorSeries indicators = engine.compute(series(60));
        IndicatorRow row = indicators.get(59);

        assertEquals(row.macd - row.macdSignal, row.macdHist, EPS);
        assertEquals((row.bbUpper + row.bbLower) / 2.0, row.sma20, 1e-6);
        assertEquals((row.bbUpper - row.bbLower) / row.sma20 * 100.0, row.bbBandwidth, 1e-6);
        // synthetic bars span high-low of 2.0 with small day-to-day moves
        assertEquals(2.0, row.atr14, 0.2);
    }

    @Test
    void computeShouldBeDeterministicAndHandleEmptyInput() {
        PriceSeries series = series(120);

        assertEquals(engine.compute(series), engine.compute(series));
        assertTrue(engine.compute(PriceSeries.empty("AAPL")).isEmpty());
        assertEquals("AAPL", engine.compute(PriceSeries.empty("AAPL")).ticker());
    }

    private static PriceSeries series(int weekdays) {
        List<PriceBar> bars = new ArrayList<>();
        LocalDate d = LocalDate.of(2023, 1, 2);
        while (bars.size() < weekdays) {
            bars.addAll(SyntheticProvider.weekdayBars("AAPL", d, d));
            d = d.plusDays(1);
        }
        return new PriceSeries("AAPL", bars);
    }
}
