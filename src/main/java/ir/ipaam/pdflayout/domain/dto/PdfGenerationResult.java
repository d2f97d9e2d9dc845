package ir.ipaam.pdflayout.domain.dto;

import java.util.Objects;

public record PdfGenerationResult(String fileName, byte[] pdfBytes, int pageCount) {

    public PdfGenerationResult {
        Objects.requireNonNull(fileName, "fileName");
        Objects.requireNonNull(pdfBytes, "pdfBytes");
    }
}
