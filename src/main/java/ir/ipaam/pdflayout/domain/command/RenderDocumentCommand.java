package ir.ipaam.pdflayout.domain.command;

import ir.ipaam.pdflayout.api.dto.DocumentRequest;

public record RenderDocumentCommand(DocumentRequest request) {
}
