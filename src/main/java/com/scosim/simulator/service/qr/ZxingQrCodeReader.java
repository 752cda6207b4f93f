package com.scosim.simulator.service.qr;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.BinaryBitmap;
import com.google.zxing.ChecksumException;
import com.google.zxing.DecodeHintType;
import com.google.zxing.FormatException;
import com.google.zxing.LuminanceSource;
import com.google.zxing.NotFoundException;
import com.google.zxing.Result;
import com.google.zxing.client.j2se.BufferedImageLuminanceSource;
import com.google.zxing.common.HybridBinarizer;
import com.google.zxing.qrcode.QRCodeReader;
import com.scosim.simulator.model.BgrImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * QR decoding with ZXing. Not thread-safe; each extractor owns its reader.
 */
public class ZxingQrCodeReader implements CodeReader {

    private static final Logger logger = LoggerFactory.getLogger(ZxingQrCodeReader.class);

    private final QRCodeReader reader = new QRCodeReader();
    private final Map<DecodeHintType, Object> hints = new EnumMap<>(DecodeHintType.class);

    public ZxingQrCodeReader() {
        hints.put(DecodeHintType.TRY_HARDER, Boolean.TRUE);
        hints.put(DecodeHintType.POSSIBLE_FORMATS, List.of(BarcodeFormat.QR_CODE));
        hints.put(DecodeHintType.CHARACTER_SET, StandardCharsets.UTF_8.name());
    }

    @Override
    public Optional<String> decode(BgrImage image) {
        LuminanceSource source = new BufferedImageLuminanceSource(image.toBufferedImage());
        BinaryBitmap bitmap = new BinaryBitmap(new HybridBinarizer(source));
        try {
            Result result = reader.decode(bitmap, hints);
            String text = result.getText();
            return text == null || text.isEmpty() ? Optional.empty() : Optional.of(text);
        } catch (NotFoundException e) {
            return Optional.empty();
        } catch (ChecksumException | FormatException e) {
            logger.debug("QR code found but unreadable: {}", e.toString());
            return Optional.empty();
        } finally {
            reader.reset();
        }
    }
}
