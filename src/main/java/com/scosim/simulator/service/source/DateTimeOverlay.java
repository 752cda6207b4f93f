package com.scosim.simulator.service.source;

import com.scosim.simulator.model.BgrImage;

import java.awt.Color;
import java.awt.Font;
import java.awt.FontMetrics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/**
 * Renders the capture time as yellow text on a black box near the top-left corner.
 */
public class DateTimeOverlay implements FrameOverlay {

    private static final int X = 10;
    private static final int BASELINE_Y = 40;
    private static final int PADDING = 5;
    private static final Font FONT = new Font(Font.SANS_SERIF, Font.BOLD, 18);

    private final DateTimeFormatter formatter;

    public DateTimeOverlay(ZoneId zone) {
        this.formatter = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(zone);
    }

    String format(long timestampMillis) {
        return formatter.format(Instant.ofEpochMilli(timestampMillis));
    }

    @Override
    public BgrImage apply(BgrImage image, long timestampMillis) {
        String text = format(timestampMillis);
        BufferedImage canvas = image.toBufferedImage();
        Graphics2D g = canvas.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
            g.setFont(FONT);
            FontMetrics metrics = g.getFontMetrics();
            int textWidth = metrics.stringWidth(text);
            g.setColor(Color.BLACK);
            g.fillRect(X - PADDING, BASELINE_Y - metrics.getAscent() - PADDING,
                    textWidth + 2 * PADDING, metrics.getAscent() + metrics.getDescent() + 2 * PADDING);
            g.setColor(Color.YELLOW);
            g.drawString(text, X, BASELINE_Y);
        } finally {
            g.dispose();
        }
        return BgrImage.fromBufferedImage(canvas);
    }
}
