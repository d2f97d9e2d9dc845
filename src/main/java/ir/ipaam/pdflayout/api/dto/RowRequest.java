package ir.ipaam.pdflayout.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RowRequest {
    @NotEmpty private List<String> cells;
    @Valid private ColorRequest background;

    public RowRequest(List<String> cells) {
        this.cells = cells;
    }
}
