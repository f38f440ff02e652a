package com.example.pdfoutline.controller;

import com.example.pdfoutline.exception.InvalidSpanInputException;
import com.example.pdfoutline.exception.PdfExtractionException;
import com.example.pdfoutline.model.BatchItemResult;
import com.example.pdfoutline.model.NamedPdf;
import com.example.pdfoutline.model.OutlineResult;
import com.example.pdfoutline.model.SpanDocument;
import com.example.pdfoutline.service.BatchOutlineService;
import com.example.pdfoutline.service.OutlineExtractionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP front end of the outline extractor.
 */
@RestController
@RequestMapping("/api/outline")
@CrossOrigin(origins = "*")
public class OutlineController {

    private static final Logger logger = LoggerFactory.getLogger(OutlineController.class);

    @Autowired
    private OutlineExtractionService extractionService;

    @Autowired
    private BatchOutlineService batchOutlineService;

    @Autowired
    private ObjectMapper objectMapper;

    @Value("${outline.upload.max-file-size-mb:100}")
    private long maxFileSizeMb;

    /**
     * Builds the heading outline of an uploaded PDF.
     * @param file            the PDF
     * @param includeMetadata also return the extraction diagnostics
     */
    @PostMapping(value = "/extract", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<String> extract(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "includeMetadata", defaultValue = "false") boolean includeMetadata) {
        try {
            ValidationResult validation = validateFile(file);
            if (!validation.isValid()) {
                logger.warn("File validation failed: {}", validation.getMessage());
                return ResponseEntity.badRequest()
                        .contentType(MediaType.APPLICATION_JSON)
                        .body(createErrorResponse(validation.getMessage()));
            }

            logger.info("Extracting outline from: {}, size: {} bytes", file.getOriginalFilename(), file.getSize());
            OutlineResult result = extractionService.extractFromPdf(file.getBytes());
            return ok(result, includeMetadata);

        } catch (PdfExtractionException e) {
            logger.warn("Unreadable PDF {}: {}", file.getOriginalFilename(), e.getMessage());
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(createErrorResponse(e.getMessage()));
        } catch (IOException e) {
            logger.error("IO error extracting outline: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(createErrorResponse("File read failed: " + e.getMessage()));
        } catch (Exception e) {
            logger.error("Unexpected error extracting outline: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(createErrorResponse("System error: " + e.getMessage()));
        }
    }

    /**
     * Builds the outline of spans collected elsewhere.
     */
    @PostMapping(value = "/from-spans", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<String> fromSpans(
            @RequestBody SpanDocument document,
            @RequestParam(value = "includeMetadata", defaultValue = "false") boolean includeMetadata) {
        try {
            logger.info("Extracting outline from {} supplied spans", document.getSpans().size());
            return ok(extractionService.extract(document), includeMetadata);
        } catch (InvalidSpanInputException e) {
            logger.warn("Rejected span input: {}", e.getMessage());
            return ResponseEntity.badRequest()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(createErrorResponse(e.getMessage()));
        } catch (Exception e) {
            logger.error("Unexpected error extracting outline from spans: {}", e.getMessage(), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(createErrorResponse("System error: " + e.getMessage()));
        }
    }

    @PostMapping(value = "/batch", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<String> batch(@RequestParam("files") MultipartFile[] files) {
        logger.info("Batch extraction of {} files", files.length);

        // Slots keep the response in upload order; invalid files never reach the pool
        List<BatchItemResult> slots = new ArrayList<>();
        List<Integer> pending = new ArrayList<>();
        List<NamedPdf> documents = new ArrayList<>();
        for (MultipartFile file : files) {
            String name = file.getOriginalFilename();
            ValidationResult validation = validateFile(file);
            if (!validation.isValid()) {
                slots.add(BatchItemResult.failure(name, "Validation failed: " + validation.getMessage()));
                continue;
            }
            try {
                documents.add(new NamedPdf(name, file.getBytes()));
                pending.add(slots.size());
                slots.add(null);
            } catch (IOException e) {
                logger.error("Error reading file {}: {}", name, e.getMessage());
                slots.add(BatchItemResult.failure(name, "File read failed: " + e.getMessage()));
            }
        }

        List<BatchItemResult> extracted = batchOutlineService.extractAll(documents);
        for (int i = 0; i < pending.size(); i++) {
            slots.set(pending.get(i), extracted.get(i));
        }

        long successCount = slots.stream().filter(BatchItemResult::isSuccess).count();
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("total", files.length);
        response.put("success", successCount);
        response.put("failed", files.length - successCount);
        response.put("results", slots);

        try {
            return ResponseEntity.ok()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(objectMapper.writeValueAsString(response));
        } catch (Exception e) {
            return ResponseEntity.internalServerError()
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(createErrorResponse("Response serialization failed"));
        }
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", "UP");
        health.put("service", "PDF Outline Service");
        health.put("version", "1.0");
        health.put("timestamp", System.currentTimeMillis());
        return ResponseEntity.ok(health);
    }

    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> info() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("serviceName", "PDF Heading Outline Extractor");
        info.put("version", "1.0");
        info.put("algorithm", "font-size clustering with layout and numbering features");
        info.put("supportedFormats", new String[]{"PDF"});
        info.put("maxFileSizeMB", maxFileSizeMb);
        info.put("levels", new String[]{"H1", "H2", "H3", "H4"});
        info.put("scripts", new String[]{"Latin", "Devanagari", "CJK", "Hangul", "Arabic"});
        return ResponseEntity.ok(info);
    }

    private ResponseEntity<String> ok(OutlineResult result, boolean includeMetadata) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("title", result.getOutline().getTitle());
        body.put("outline", result.getOutline().getEntries());
        if (includeMetadata) {
            body.put("metadata", result.getMetadata());
        }
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(objectMapper.writeValueAsString(body));
    }

    private ValidationResult validateFile(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            return ValidationResult.invalid("File is empty");
        }

        long maxBytes = maxFileSizeMb * 1024 * 1024;
        if (file.getSize() > maxBytes) {
            return ValidationResult.invalid(String.format("File too large, at most %d MB", maxFileSizeMb));
        }

        String contentType = file.getContentType();
        if (contentType == null || !contentType.equals(MediaType.APPLICATION_PDF_VALUE)) {
            return ValidationResult.invalid("Only PDF files are supported");
        }

        String filename = file.getOriginalFilename();
        if (filename == null || !filename.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            return ValidationResult.invalid("File extension must be .pdf");
        }

        return ValidationResult.valid();
    }

    private String createErrorResponse(String message) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("success", false);
        error.put("error", message);
        error.put("timestamp", System.currentTimeMillis());

        try {
            return objectMapper.writeValueAsString(error);
        } catch (Exception e) {
            return "{\"success\":false,\"error\":\"" + message.replace("\"", "'") + "\"}";
        }
    }

    private static final class ValidationResult {
        private final boolean valid;
        private final String message;

        private ValidationResult(boolean valid, String message) {
            this.valid = valid;
            this.message = message;
        }

        static ValidationResult valid() {
            return new ValidationResult(true, null);
        }

        static ValidationResult invalid(String message) {
            return new ValidationResult(false, message);
        }

        boolean isValid() {
            return valid;
        }

        String getMessage() {
            return message;
        }
    }
}
