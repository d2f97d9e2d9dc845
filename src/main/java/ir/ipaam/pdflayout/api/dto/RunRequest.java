package ir.ipaam.pdflayout.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A piece of paragraph text with its own formatting. Unset fields inherit from the document. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RunRequest {
    @NotNull private String text;
    private Boolean bold;
    private Boolean italic;
    @Positive private Integer fontSize;
    @Valid private ColorRequest color;

    public RunRequest(String text) {
        this.text = text;
    }
}
