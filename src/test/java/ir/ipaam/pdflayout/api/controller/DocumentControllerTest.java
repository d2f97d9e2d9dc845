package ir.ipaam.pdflayout.api.controller;

import ir.ipaam.pdflayout.domain.command.RenderDocumentCommand;
import ir.ipaam.pdflayout.domain.dto.PdfGenerationResult;
import ir.ipaam.pdflayout.domain.exception.ConfigurationException;
import ir.ipaam.pdflayout.domain.exception.LayoutException;
import ir.ipaam.pdflayout.domain.exception.RenderBackendException;
import org.axonframework.commandhandling.CommandExecutionException;
import org.axonframework.commandhandling.gateway.CommandGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DocumentControllerTest {

    private static final String BODY = """
            {
              "fileName": "report.pdf",
              "headerText": "Report",
              "blocks": [
                {"type": "PARAGRAPH", "alignment": "CENTER", "runs": [{"text": "Title", "bold": true}]},
                {"type": "BREAK", "lines": 1.5},
                {"type": "TABLE", "weights": [2, 2], "grid": true,
                 "rows": [{"cells": ["a", "b"], "background": {"red": 59, "green": 59, "blue": 59}}]}
              ]
            }
            """;

    private CommandGateway commandGateway;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        commandGateway = mock(CommandGateway.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new DocumentController(commandGateway))
                .setControllerAdvice(new LayoutExceptionHandler())
                .build();
    }

    @Test
    void returnsRenderedPdfAsAttachment() throws Exception {
        byte[] pdf = "%PDF-1.4".getBytes();
        when(commandGateway.sendAndWait(any(RenderDocumentCommand.class)))
                .thenReturn(new PdfGenerationResult("report.pdf", pdf, 2));

        mockMvc.perform(post("/documents").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_PDF))
                .andExpect(header().string("Content-Disposition",
                        containsString("report.pdf")))
                .andExpect(header().string(DocumentController.PAGE_COUNT_HEADER, "2"))
                .andExpect(content().bytes(pdf));

        ArgumentCaptor<RenderDocumentCommand> command = ArgumentCaptor.forClass(RenderDocumentCommand.class);
        verify(commandGateway).sendAndWait(command.capture());
        assertThat(command.getValue().request().getBlocks()).hasSize(3);
        assertThat(command.getValue().request().getBlocks().get(2).getRows().get(0).getCells())
                .containsExactly("a", "b");
    }

    @Test
    void requestWithoutBlocksIsRejected() throws Exception {
        mockMvc.perform(post("/documents").contentType(MediaType.APPLICATION_JSON).content("{\"blocks\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.detail", containsString("blocks")));

        verify(commandGateway, never()).sendAndWait(any());
    }

    @Test
    void layoutFailureIsUnprocessable() throws Exception {
        when(commandGateway.sendAndWait(any(RenderDocumentCommand.class)))
                .thenThrow(new CommandExecutionException("failed", new LayoutException("Word 'x' is too wide")));

        mockMvc.perform(post("/documents").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.title").value("LayoutException"))
                .andExpect(jsonPath("$.detail").value("Word 'x' is too wide"));
    }

    @Test
    void configurationFailureIsServerError() throws Exception {
        when(commandGateway.sendAndWait(any(RenderDocumentCommand.class)))
                .thenThrow(new CommandExecutionException("failed", new ConfigurationException("Unknown font")));

        mockMvc.perform(post("/documents").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.title").value("ConfigurationException"));
    }

    @Test
    void backendFailureIsBadGateway() throws Exception {
        when(commandGateway.sendAndWait(any(RenderDocumentCommand.class)))
                .thenThrow(new CommandExecutionException("failed",
                        new RenderBackendException("Failed to write PDF document", new IOException("disk"))));

        mockMvc.perform(post("/documents").contentType(MediaType.APPLICATION_JSON).content(BODY))
                .andExpect(status().isBadGateway());
    }
}
