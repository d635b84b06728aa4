package com.mmbrief.output;

import com.mmbrief.model.IndicatorRow;
import com.mmbrief.model.IndicatorSeries;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;

/**
 * Writes an indicator series as CSV. Same series in, same bytes out: fixed column order,
 * US locale, six decimals, {@code \n} line endings, undefined values as empty cells.
 */
public final class IndicatorCsvWriter {
    public static final String HEADER = "date,open,high,low,close,volume,"
            + "sma20,sma50,sma200,rsi14,macd,macd_signal,macd_hist,bb_upper,bb_lower,bb_bandwidth,atr14";

    public Path write(IndicatorSeries series, Path dir) throws IOException {
        Files.createDirectories(dir);
        Path target = dir.resolve(series.ticker().toUpperCase(Locale.ROOT) + "_indicators.csv");
        Path tmp = dir.resolve(target.getFileName() + ".tmp");
        Files.writeString(tmp, render(series), StandardCharsets.UTF_8);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        return target;
    }

    public String render(IndicatorSeries series) {
        StringBuilder sb = new StringBuilder(64 + series.size() * 160);
        sb.append(HEADER).append('\n');
        for (IndicatorRow row : series.rows()) {
            sb.append(row.bar.date).append(',')
                    .append(num(row.bar.open)).append(',')
                    .append(num(row.bar.high)).append(',')
                    .append(num(row.bar.low)).append(',')
                    .append(num(row.bar.close)).append(',')
                    .append(row.bar.volume).append(',')
                    .append(num(row.sma20)).append(',')
                    .append(num(row.sma50)).append(',')
                    .append(num(row.sma200)).append(',')
                    .append(num(row.rsi14)).append(',')
                    .append(num(row.macd)).append(',')
                    .append(num(row.macdSignal)).append(',')
                    .append(num(row.macdHist)).append(',')
                    .append(num(row.bbUpper)).append(',')
                    .append(num(row.bbLower)).append(',')
                    .append(num(row.bbBandwidth)).append(',')
                    .append(num(row.atr14))
                    .append('\n');
        }
        return sb.toString();
    }

    private static String num(double value) {
        if (!Double.isFinite(value)) {
            return "";
        }
        return String.format(Locale.US, "%.6f", value);
    }
}
