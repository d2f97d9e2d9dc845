package ir.ipaam.pdflayout.api.controller;

import io.swagger.v3.oas.annotations.Operation;
import ir.ipaam.pdflayout.api.dto.DocumentRequest;
import ir.ipaam.pdflayout.domain.command.RenderDocumentCommand;
import ir.ipaam.pdflayout.domain.dto.PdfGenerationResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.axonframework.commandhandling.gateway.CommandGateway;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

@RestController
@RequestMapping("/documents")
@RequiredArgsConstructor
public class DocumentController {

    static final String PAGE_COUNT_HEADER = "X-Page-Count";

    private final CommandGateway commandGateway;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_PDF_VALUE)
    @Operation(summary = "Lay out paragraphs, breaks and tables over pages and render them as PDF")
    public ResponseEntity<byte[]> render(@Valid @RequestBody DocumentRequest request) {
        PdfGenerationResult result = commandGateway.sendAndWait(new RenderDocumentCommand(request));
        return buildPdfResponse(result);
    }

    private ResponseEntity<byte[]> buildPdfResponse(PdfGenerationResult result) {
        ContentDisposition contentDisposition = ContentDisposition.attachment()
                .filename(result.fileName(), StandardCharsets.UTF_8)
                .build();
        HttpHeaders headers = new HttpHeaders();
        headers.setContentDisposition(contentDisposition);
        headers.setContentType(MediaType.APPLICATION_PDF);
        headers.set(PAGE_COUNT_HEADER, String.valueOf(result.pageCount()));
        return new ResponseEntity<>(result.pdfBytes(), headers, HttpStatus.OK);
    }
}
