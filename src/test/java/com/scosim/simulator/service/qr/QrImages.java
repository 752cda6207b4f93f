package com.scosim.simulator.service.qr;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.EncodeHintType;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageConfig;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import com.scosim.simulator.model.BgrImage;

import java.util.Map;

/**
 * Renders QR codes into BGR images for tests.
 */
final class QrImages {

    private QrImages() {
    }

    static BgrImage qr(String text, int size) {
        try {
            BitMatrix matrix = new QRCodeWriter().encode(text, BarcodeFormat.QR_CODE, size, size,
                    Map.of(EncodeHintType.MARGIN, 2));
            return BgrImage.fromBufferedImage(
                    MatrixToImageWriter.toBufferedImage(matrix, new MatrixToImageConfig()));
        } catch (WriterException e) {
            throw new IllegalStateException(e);
        }
    }
}
