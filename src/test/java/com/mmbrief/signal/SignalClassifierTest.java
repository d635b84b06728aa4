package com.mmbrief.signal;

import com.mmbrief.data.SyntheticProvider;
import com.mmbrief.indicator.IndicatorEngine;
import com.mmbrief.model.IndicatorRow;
import com.mmbrief.model.IndicatorSeries;
import com.mmbrief.model.PriceBar;
import com.mmbrief.model.PriceSeries;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignalClassifierTest {
    private static final double NaN = Double.NaN;

    private final SignalClassifier classifier = new SignalClassifier();

    @Test
    void trendShouldFollowCloseAndMovingAverageOrdering() {
        assertEquals(TrendSignal.BULLISH, SignalClassifier.trend(row(110, 105, 100)));
        assertEquals(TrendSignal.BEARISH, SignalClassifier.trend(row(90, 95, 100)));
        assertEquals(TrendSignal.LEANING_BULLISH, SignalClassifier.trend(row(103, 106, 100)));
        assertEquals(TrendSignal.LEANING_BEARISH, SignalClassifier.trend(row(97, 94, 100)));
        assertEquals(TrendSignal.NEUTRAL, SignalClassifier.trend(row(100, 105, 100)));
    }

    @Test
    void trendShouldBeUnknownWhenLongAveragesAreUndefined() {
        assertEquals(TrendSignal.UNKNOWN, SignalClassifier.trend(row(110, 105, NaN)));
        assertEquals(TrendSignal.UNKNOWN, SignalClassifier.trend(row(110, NaN, NaN)));
    }

    @Test
    void momentumThresholdsShouldBeStrict() {
        assertEquals(MomentumSignal.OVERBOUGHT, SignalClassifier.momentum(70.01));
        assertEquals(MomentumSignal.STRONG, SignalClassifier.momentum(70.0));
        assertEquals(MomentumSignal.STRONG, SignalClassifier.momentum(60.01));
        assertEquals(MomentumSignal.NEUTRAL, SignalClassifier.momentum(60.0));
        assertEquals(MomentumSignal.NEUTRAL, SignalClassifier.momentum(50.0));
        assertEquals(MomentumSignal.NEUTRAL, SignalClassifier.momentum(40.0));
        assertEquals(MomentumSignal.WEAK, SignalClassifier.momentum(39.99));
        assertEquals(MomentumSignal.WEAK, SignalClassifier.momentum(30.0));
        assertEquals(MomentumSignal.OVERSOLD, SignalClassifier.momentum(29.99));
    }

    @Test
    void volatilityShouldCompareAgainstTrailingMean() {
        assertEquals(VolatilitySignal.ELEVATED, SignalClassifier.volatility(15.01, 10.0));
        assertEquals(VolatilitySignal.NORMAL, SignalClassifier.volatility(15.0, 10.0));
        assertEquals(VolatilitySignal.NORMAL, SignalClassifier.volatility(7.0, 10.0));
        assertEquals(VolatilitySignal.COMPRESSED, SignalClassifier.volatility(6.99, 10.0));
        assertEquals(VolatilitySignal.NORMAL, SignalClassifier.volatility(NaN, 10.0));
        assertEquals(VolatilitySignal.NORMAL, SignalClassifier.volatility(12.0, NaN));
    }

    @Test
    void trailingBandwidthMeanShouldNeedTwentyDefinedValues() {
        double[] nineteen = new double[19];
        Arrays.fill(nineteen, 4.0);
        assertTrue(Double.isNaN(SignalClassifier.trailingBandwidthMean(nineteen)));

        double[] values = new double[25];
        Arrays.fill(values, 4.0);
        values[0] = NaN;
        values[24] = 24.0;
        assertEquals((19 * 4.0 + 24.0) / 20.0, SignalClassifier.trailingBandwidthMean(values), 1e-9);

        values[10] = NaN;
        assertTrue(Double.isNaN(SignalClassifier.trailingBandwidthMean(values)));
    }

    @Test
    void classifyShouldReturnUnknownForEmptySeries() {
        SignalSet signals = classifier.classify(new IndicatorSeries("AAPL", List.of()));

        assertEquals(SignalSet.unknown(), signals);
        assertEquals("Unknown", signals.asLabels().get("Trend"));
    }

    @Test
    void risingSeriesOfTwoHundredFiftyDaysShouldBeBullishAndOverbought() {
        List<PriceBar> bars = new ArrayList<>();
        LocalDate d = LocalDate.of(2023, 1, 2);
        while (bars.size() < 250) {
            bars.addAll(SyntheticProvider.weekdayBars("AAPL", d, d));
            d = d.plusDays(1);
        }

        SignalSet signals = classifier.classify(new IndicatorEngine().compute(new PriceSeries("AAPL", bars)));

        assertEquals(TrendSignal.BULLISH, signals.trend());
        assertEquals(MomentumSignal.OVERBOUGHT, signals.momentum());
        assertEquals("Bullish", signals.asLabels().get("Trend"));
    }

    @Test
    void shortSeriesShouldLeaveTrendUnknown() {
        List<PriceBar> bars = SyntheticProvider.weekdayBars("AAPL", LocalDate.of(2024, 1, 1), LocalDate.of(2024, 3, 29));

        SignalSet signals = classifier.classify(new IndicatorEngine().compute(new PriceSeries("AAPL", bars)));

        assertEquals(TrendSignal.UNKNOWN, signals.trend());
    }

    private static IndicatorRow row(double close, double sma50, double sma200) {
        PriceBar bar = new PriceBar("AAPL", LocalDate.of(2024, 6, 14), close, close, close, close, 1L);
        return new IndicatorRow(bar, NaN, sma50, sma200, NaN, NaN, NaN, NaN, NaN, NaN, NaN, NaN);
    }
}
