package com.loyaltycard.enrollment;

import com.google.zxing.BarcodeFormat;
import com.google.zxing.WriterException;
import com.google.zxing.client.j2se.MatrixToImageWriter;
import com.google.zxing.common.BitMatrix;
import com.google.zxing.qrcode.QRCodeWriter;
import com.loyaltycard.common.exception.EnrollmentCodeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes enrollment QR codes as PNG files into a local directory.
 */
@Component
@Slf4j
public class QrCodeEnrollmentStore implements EnrollmentCodeStore {

    private static final String IMAGE_FORMAT = "PNG";

    private final Path directory;
    private final int imageSize;

    public QrCodeEnrollmentStore(
            @Value("${loyalty-card.enrollment.directory:qrcodes}") String directory,
            @Value("${loyalty-card.enrollment.image-size:300}") int imageSize) {
        this.directory = Paths.get(directory).toAbsolutePath().normalize();
        this.imageSize = imageSize;

        log.info("QR enrollment store initialized: directory={}, size={}px", this.directory, imageSize);
    }

    @Override
    public String store(String customerId, String payload) {
        Path file = directory.resolve("customer_" + customerId + ".png");
        try {
            Files.createDirectories(directory);
            BitMatrix bitMatrix = new QRCodeWriter().encode(payload, BarcodeFormat.QR_CODE, imageSize, imageSize);
            MatrixToImageWriter.writeToPath(bitMatrix, IMAGE_FORMAT, file);
        } catch (WriterException | IOException e) {
            throw new EnrollmentCodeException("Failed to generate QR code for customer " + customerId, e);
        }

        log.debug("Stored QR code for customer {} at {}", customerId, file);
        return file.toString();
    }

    @Override
    public void remove(String reference) {
        if (reference == null || reference.isBlank()) {
            return;
        }
        Path file = Paths.get(reference).toAbsolutePath().normalize();
        if (!file.startsWith(directory)) {
            throw new EnrollmentCodeException("Refusing to remove QR code outside " + directory + ": " + reference, null);
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new EnrollmentCodeException("Failed to remove QR code " + reference, e);
        }
    }

    Path getDirectory() {
        return directory;
    }
}
