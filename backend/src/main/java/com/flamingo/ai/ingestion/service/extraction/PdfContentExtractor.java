package com.flamingo.ai.ingestion.service.extraction;

import com.flamingo.ai.ingestion.config.IngestionConfig;
import com.flamingo.ai.ingestion.domain.model.MetadataKeys;
import com.flamingo.ai.ingestion.exception.ExtractionException;
import com.flamingo.ai.ingestion.service.extraction.model.ExtractedSegment;
import com.flamingo.ai.ingestion.service.extraction.model.ExtractionFailure;
import com.flamingo.ai.ingestion.service.extraction.model.ExtractionResult;
import com.flamingo.ai.ingestion.service.ingestion.model.SourcePart;
import com.google.common.annotations.VisibleForTesting;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import javax.imageio.ImageIO;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.contentstream.PDFStreamEngine;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.contentstream.operator.OperatorName;
import org.apache.pdfbox.contentstream.operator.OperatorProcessor;
import org.apache.pdfbox.contentstream.operator.state.Concatenate;
import org.apache.pdfbox.contentstream.operator.state.Restore;
import org.apache.pdfbox.contentstream.operator.state.Save;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.util.Matrix;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * {@link ContentExtractor} for PDF files, one segment per page.
 *
 * <p>Uses Apache PDFBox 3.x. A page is treated as a scan when a single image drawn on it covers
 * at least the configured fraction of the media box; such pages are rasterized and sent to the
 * {@link OcrService}. Every other page goes through {@link PDFTextStripper}. A page that fails is
 * reported and skipped; the remaining pages are still extracted.
 *
 * <p>Page numbers in segment metadata are 1-based.
 */
@Service
@Slf4j
public class PdfContentExtractor implements ContentExtractor {

  private final OcrService ocrService;
  private final double imageAreaThreshold;
  private final float renderDpi;

  @Autowired
  public PdfContentExtractor(OcrService ocrService, IngestionConfig ingestionConfig) {
    this(
        ocrService,
        ingestionConfig.getPdf().getImageAreaThreshold(),
        ingestionConfig.getPdf().getRenderDpi());
  }

  @VisibleForTesting
  public PdfContentExtractor(OcrService ocrService, double imageAreaThreshold, float renderDpi) {
    this.ocrService = ocrService;
    this.imageAreaThreshold = imageAreaThreshold;
    this.renderDpi = renderDpi;
  }

  @Override
  public Set<String> supportedMediaTypes() {
    return Set.of("application/pdf");
  }

  @Override
  public Set<String> supportedExtensions() {
    return Set.of("pdf");
  }

  @Override
  public ExtractionResult extract(SourcePart part) {
    try (PDDocument pdf = Loader.loadPDF(part.content())) {
      List<ExtractedSegment> segments = new ArrayList<>();
      List<ExtractionFailure> failures = new ArrayList<>();
      PDFRenderer renderer = new PDFRenderer(pdf);
      PDFTextStripper stripper = new PDFTextStripper();

      for (int pageIndex = 0; pageIndex < pdf.getNumberOfPages(); pageIndex++) {
        int pageNumber = pageIndex + 1;
        try {
          PDPage page = pdf.getPage(pageIndex);
          double imageCoverage = largestImageCoverage(page);
          String text;
          String method;
          if (imageCoverage >= imageAreaThreshold) {
            log.debug(
                "Page {} of {} is {}% image, using OCR",
                pageNumber,
                part.fileName(),
                Math.round(imageCoverage * 100));
            text = ocrPage(renderer, pageIndex);
            method = "ocr";
          } else {
            stripper.setStartPage(pageNumber);
            stripper.setEndPage(pageNumber);
            text = stripper.getText(pdf);
            method = "text";
          }
          segments.add(
              new ExtractedSegment(
                  text, Map.of(MetadataKeys.PAGE, pageNumber, MetadataKeys.EXTRACTION, method)));
        } catch (IOException | RuntimeException e) {
          log.warn("Skipping page {} of {}: {}", pageNumber, part.fileName(), e.getMessage());
          failures.add(
              new ExtractionFailure(
                  part.fileName() + " page " + pageNumber, e.getMessage(), false));
        }
      }

      log.info(
          "Extracted {} of {} pages from {}",
          segments.size(),
          pdf.getNumberOfPages(),
          part.fileName());
      return new ExtractionResult(segments, failures);
    } catch (IOException e) {
      throw new ExtractionException(part.fileName(), "Failed to read PDF: " + e.getMessage(), e);
    }
  }

  /** Returns the largest fraction of the page's media box covered by one drawn image. */
  @VisibleForTesting
  double largestImageCoverage(PDPage page) throws IOException {
    PDRectangle mediaBox = page.getMediaBox();
    double pageArea = (double) mediaBox.getWidth() * mediaBox.getHeight();
    if (pageArea <= 0) {
      return 0;
    }
    ImageAreaCollector collector = new ImageAreaCollector();
    collector.processPage(page);
    return Math.min(1.0, collector.largestArea / pageArea);
  }

  private String ocrPage(PDFRenderer renderer, int pageIndex) throws IOException {
    BufferedImage image = renderer.renderImageWithDPI(pageIndex, renderDpi, ImageType.RGB);
    ByteArrayOutputStream png = new ByteArrayOutputStream();
    ImageIO.write(image, "png", png);
    return ocrService.extractText(png.toByteArray(), "image/png");
  }

  /** Tracks the user-space area of every image XObject drawn on a page. */
  private static final class ImageAreaCollector extends PDFStreamEngine {

    private double largestArea = 0;

    ImageAreaCollector() {
      addOperator(new Concatenate(this));
      addOperator(new Save(this));
      addOperator(new Restore(this));
      addOperator(new DrawObject(this));
    }

    /** Processes "Do": images are measured, forms are walked recursively. */
    private static final class DrawObject extends OperatorProcessor {

      private final ImageAreaCollector collector;

      DrawObject(ImageAreaCollector collector) {
        super(collector);
        this.collector = collector;
      }

      @Override
      public void process(Operator operator, List<COSBase> operands) throws IOException {
        if (operands.isEmpty() || !(operands.get(0) instanceof COSName objectName)) {
          return;
        }
        PDXObject xObject = collector.getResources().getXObject(objectName);
        if (xObject instanceof PDImageXObject) {
          Matrix ctm = collector.getGraphicsState().getCurrentTransformationMatrix();
          // images are drawn into the unit square, so the CTM determinant is the drawn area
          double area =
              Math.abs(
                  (double) ctm.getScaleX() * ctm.getScaleY()
                      - (double) ctm.getShearX() * ctm.getShearY());
          collector.largestArea = Math.max(collector.largestArea, area);
        } else if (xObject instanceof PDFormXObject form) {
          collector.showForm(form);
        }
      }

      @Override
      public String getName() {
        return OperatorName.DRAW_OBJECT;
      }
    }
  }
}
