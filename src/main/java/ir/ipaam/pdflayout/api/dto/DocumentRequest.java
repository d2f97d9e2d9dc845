package ir.ipaam.pdflayout.api.dto;

import ir.ipaam.pdflayout.domain.model.geometry.PaperSize;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
public class DocumentRequest {
    private String fileName;
    private PaperSize paperSize;
    @PositiveOrZero private Double margins;
    private String fontFamily;
    @Positive private Integer fontSize;

    /** Printed on top of every page after the first, followed by the page number. */
    private String headerText;

    @NotEmpty @Valid private List<BlockRequest> blocks = new ArrayList<>();
}
