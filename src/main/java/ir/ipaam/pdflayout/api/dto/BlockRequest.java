package ir.ipaam.pdflayout.api.dto;

import ir.ipaam.pdflayout.domain.model.element.Alignment;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * One top level block of a document. Which fields apply depends on {@link #type}:
 * paragraphs use {@code runs}, {@code alignment}, {@code framed} and {@code padding};
 * breaks use {@code lines}; tables use {@code weights}, {@code rows} and {@code grid}.
 */
@Data
public class BlockRequest {
    @NotNull private BlockType type;

    @Valid private List<RunRequest> runs = new ArrayList<>();
    private Alignment alignment;
    private boolean framed;
    @PositiveOrZero private Double padding;

    @PositiveOrZero private Double lines;

    private List<Integer> weights = new ArrayList<>();
    @Valid private List<RowRequest> rows = new ArrayList<>();
    private boolean grid;
}
