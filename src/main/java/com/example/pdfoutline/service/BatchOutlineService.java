package com.example.pdfoutline.service;

import com.example.pdfoutline.model.BatchItemResult;
import com.example.pdfoutline.model.NamedPdf;
import com.example.pdfoutline.model.OutlineResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Extracts outlines for several PDFs in parallel. One document failing does not affect the others.
 */
@Service
public class BatchOutlineService {

    private static final Logger logger = LoggerFactory.getLogger(BatchOutlineService.class);

    private final OutlineExtractionService extractionService;
    private final AsyncTaskExecutor executor;

    public BatchOutlineService(OutlineExtractionService extractionService,
                               @Qualifier("outlineBatchExecutor") AsyncTaskExecutor executor) {
        this.extractionService = extractionService;
        this.executor = executor;
    }

    /** Results come back in input order. */
    public List<BatchItemResult> extractAll(List<NamedPdf> documents) {
        long start = System.currentTimeMillis();
        List<Future<OutlineResult>> futures = new ArrayList<>(documents.size());
        for (NamedPdf doc : documents) {
            futures.add(executor.submit(() -> extractionService.extractFromPdf(doc.getContent())));
        }

        List<BatchItemResult> results = new ArrayList<>(documents.size());
        int failed = 0;
        for (int i = 0; i < documents.size(); i++) {
            String name = documents.get(i).getName();
            try {
                results.add(BatchItemResult.success(name, futures.get(i).get().getOutline()));
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                logger.error("Batch item {} failed: {}", name, cause.getMessage());
                results.add(BatchItemResult.failure(name, cause.getMessage()));
                failed++;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for {}, cancelling {} remaining items", name, documents.size() - i);
                futures.subList(i, futures.size()).forEach(f -> f.cancel(true));
                for (int j = i; j < documents.size(); j++) {
                    results.add(BatchItemResult.failure(documents.get(j).getName(), "Interrupted"));
                    failed++;
                }
                break;
            }
        }

        long total = System.currentTimeMillis() - start;
        logger.info("Batch finished: {} successful, {} failed, {} ms total, {} ms average",
                documents.size() - failed, failed, total, documents.isEmpty() ? 0 : total / documents.size());
        return results;
    }
}
