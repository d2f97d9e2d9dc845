package ir.ipaam.pdflayout.application.service;

import ir.ipaam.pdflayout.api.dto.DocumentRequest;
import ir.ipaam.pdflayout.api.mapper.DocumentRequestMapper;
import ir.ipaam.pdflayout.config.LayoutProperties;
import ir.ipaam.pdflayout.domain.document.Document;
import ir.ipaam.pdflayout.domain.document.SimplePageDecorator;
import ir.ipaam.pdflayout.domain.dto.PdfGenerationResult;
import ir.ipaam.pdflayout.domain.exception.DocumentException;
import ir.ipaam.pdflayout.domain.font.FontBackend;
import ir.ipaam.pdflayout.domain.model.element.Element;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/** Builds a {@link Document} from a request, filling gaps from {@link LayoutProperties}, and renders it to PDF. */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentRenderService {

    private final FontBackend fontBackend;
    private final LayoutProperties properties;

    public PdfGenerationResult render(DocumentRequest request) throws DocumentException {
        String family = request.getFontFamily() != null ? request.getFontFamily() : properties.getFontFamily();
        Document document = Document.create(fontBackend, family);
        document.setPaperSize(request.getPaperSize() != null ? request.getPaperSize() : properties.getPaperSize());
        document.setFontSize(request.getFontSize() != null ? request.getFontSize() : properties.getFontSize());

        SimplePageDecorator decorator = new SimplePageDecorator();
        decorator.setMargins(request.getMargins() != null ? request.getMargins() : properties.getMargins());
        decorator.setHeader(DocumentRequestMapper.toHeader(request.getHeaderText()));
        document.setPageDecorator(decorator);

        for (Element element : DocumentRequestMapper.toElements(request.getBlocks())) {
            document.push(element);
        }

        byte[] pdf = document.render();
        String fileName = resolveFileName(request.getFileName());
        log.info("Rendered {} with {} pages ({} bytes)", fileName, document.getRenderedPages(), pdf.length);
        return new PdfGenerationResult(fileName, pdf, document.getRenderedPages());
    }

    private static String resolveFileName(String requested) {
        if (requested == null || requested.isBlank()) {
            return UUID.randomUUID() + ".pdf";
        }
        return requested.toLowerCase().endsWith(".pdf") ? requested : requested + ".pdf";
    }
}
