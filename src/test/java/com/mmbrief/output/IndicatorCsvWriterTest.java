package com.mmbrief.output;

import com.mmbrief.data.SyntheticProvider;
import com.mmbrief.indicator.IndicatorEngine;
import com.mmbrief.model.IndicatorSeries;
import com.mmbrief.model.PriceSeries;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndicatorCsvWriterTest {

    @TempDir
    Path tempDir;

    private final IndicatorCsvWriter writer = new IndicatorCsvWriter();

    @Test
    void renderShouldWriteHeaderAndEmptyCellsForUndefinedValues() {
        IndicatorSeries series = indicators("aapl", LocalDate.of(2024, 6, 3), LocalDate.of(2024, 6, 14));

        List<String> lines = writer.render(series).lines().toList();

        assertEquals(IndicatorCsvWriter.HEADER, lines.get(0));
        assertEquals(11, lines.size());
        String first = lines.get(1);
        assertTrue(first.startsWith("2024-06-03,"));
        // sma20 is still undefined on the first row
        String[] cells = first.split(",", -1);
        assertEquals(17, cells.length);
        assertEquals("", cells[6]);
        assertFalse(cells[10].isEmpty());
    }

    @Test
    void writeShouldProduceIdenticalBytesOnRerun() throws Exception {
        IndicatorSeries series = indicators("MSFT", LocalDate.of(2023, 1, 2), LocalDate.of(2024, 6, 14));

        Path first = writer.write(series, tempDir.resolve("exports"));
        byte[] firstBytes = Files.readAllBytes(first);
        Path second = writer.write(new IndicatorEngine().compute(series(series.ticker(),
                LocalDate.of(2023, 1, 2), LocalDate.of(2024, 6, 14))), tempDir.resolve("exports"));

        assertEquals(tempDir.resolve("exports/MSFT_indicators.csv"), first);
        assertEquals(first, second);
        assertArrayEquals(firstBytes, Files.readAllBytes(second));
        assertFalse(Files.exists(tempDir.resolve("exports/MSFT_indicators.csv.tmp")));
    }

    @Test
    void numbersShouldUseSixDecimalsAndDotSeparator() {
        IndicatorSeries series = indicators("AAPL", LocalDate.of(2024, 6, 14), LocalDate.of(2024, 6, 14));

        String row = writer.render(series).lines().toList().get(1);
        double close = SyntheticProvider.closeFor(LocalDate.of(2024, 6, 14));

        assertTrue(row.contains(String.format(Locale.US, ",%.6f,", close)));
        assertTrue(row.contains("," + SyntheticProvider.volumeFor(LocalDate.of(2024, 6, 14)) + ","));
    }

    private static IndicatorSeries indicators(String ticker, LocalDate from, LocalDate to) {
        return new IndicatorEngine().compute(series(ticker, from, to));
    }

    private static PriceSeries series(String ticker, LocalDate from, LocalDate to) {
        return new PriceSeries(ticker, SyntheticProvider.weekdayBars(ticker, from, to));
    }
}
