package ir.ipaam.pdflayout.application.handler;

import ir.ipaam.pdflayout.application.service.DocumentRenderService;
import ir.ipaam.pdflayout.domain.command.RenderDocumentCommand;
import ir.ipaam.pdflayout.domain.dto.PdfGenerationResult;
import ir.ipaam.pdflayout.domain.exception.DocumentException;
import lombok.RequiredArgsConstructor;
import org.axonframework.commandhandling.CommandHandler;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DocumentCommandHandler {

    private final DocumentRenderService documentRenderService;

    @CommandHandler
    public PdfGenerationResult handle(RenderDocumentCommand command) throws DocumentException {
        return documentRenderService.render(command.request());
    }
}
