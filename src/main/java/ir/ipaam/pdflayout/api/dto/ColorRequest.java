package ir.ipaam.pdflayout.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ColorRequest {
    @Min(0) @Max(255) private int red;
    @Min(0) @Max(255) private int green;
    @Min(0) @Max(255) private int blue;
}
