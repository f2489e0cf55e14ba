package com.flamingo.ai.ingestion.service.extraction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.ingestion.domain.model.MetadataKeys;
import com.flamingo.ai.ingestion.exception.ExtractionException;
import com.flamingo.ai.ingestion.exception.LlmServiceException;
import com.flamingo.ai.ingestion.service.extraction.model.ExtractionResult;
import com.flamingo.ai.ingestion.service.ingestion.model.SourcePart;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.graphics.image.LosslessFactory;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("PdfContentExtractor Tests")
class PdfContentExtractorTest {

  @Mock private OcrService ocrService;

  private PdfContentExtractor extractor;

  @BeforeEach
  void setUp() {
    extractor = new PdfContentExtractor(ocrService, 0.7, 72f);
  }

  @Test
  @DisplayName("Should OCR only the scanned page and extract text from the other")
  void shouldOcrScannedPageAndStripTextPage() throws IOException {
    // Given: page 1 is a full-page image, page 2 is plain text
    when(ocrService.extractText(any(byte[].class), eq("image/png")))
        .thenReturn("Invoice 2024-117 total due 450 EUR");
    byte[] pdf = buildPdf(0.95, "Quarterly revenue grew by twelve percent");

    // When
    ExtractionResult result =
        extractor.extract(SourcePart.of("report.pdf", "application/pdf", pdf));

    // Then
    verify(ocrService, times(1)).extractText(any(byte[].class), eq("image/png"));
    assertThat(result.failures()).isEmpty();
    assertThat(result.segments()).hasSize(2);

    assertThat(result.segments().get(0).text()).isEqualTo("Invoice 2024-117 total due 450 EUR");
    assertThat(result.segments().get(0).metadata())
        .containsEntry(MetadataKeys.PAGE, 1)
        .containsEntry(MetadataKeys.EXTRACTION, "ocr");

    assertThat(result.segments().get(1).text()).contains("Quarterly revenue grew");
    assertThat(result.segments().get(1).metadata())
        .containsEntry(MetadataKeys.PAGE, 2)
        .containsEntry(MetadataKeys.EXTRACTION, "text");
  }

  @Test
  @DisplayName("Should not OCR a page whose image covers less than the threshold")
  void shouldNotOcrSmallImages() throws IOException {
    byte[] pdf = buildPdf(0.3, "Body text");

    ExtractionResult result = extractor.extract(SourcePart.of("small.pdf", "application/pdf", pdf));

    verify(ocrService, never()).extractText(any(byte[].class), any());
    assertThat(result.segments()).hasSize(2);
    assertThat(result.segments().get(0).metadata()).containsEntry(MetadataKeys.EXTRACTION, "text");
  }

  @Test
  @DisplayName("Should report a page whose OCR fails and keep the remaining pages")
  void shouldReportFailedPageAndContinue() throws IOException {
    when(ocrService.extractText(any(byte[].class), eq("image/png")))
        .thenThrow(new LlmServiceException("OCR response is not valid JSON"));
    byte[] pdf = buildPdf(0.95, "Second page text");

    ExtractionResult result = extractor.extract(SourcePart.of("scan.pdf", "application/pdf", pdf));

    assertThat(result.segments()).hasSize(1);
    assertThat(result.segments().get(0).metadata()).containsEntry(MetadataKeys.PAGE, 2);
    assertThat(result.failures()).hasSize(1);
    assertThat(result.failures().get(0).sourceName()).isEqualTo("scan.pdf page 1");
    assertThat(result.failures().get(0).unsupported()).isFalse();
  }

  @Test
  @DisplayName("Should measure the fraction of the page covered by the largest image")
  void shouldMeasureImageCoverage() throws IOException {
    byte[] pdf = buildPdf(0.5, "text");

    try (PDDocument document = Loader.loadPDF(pdf)) {
      assertThat(extractor.largestImageCoverage(document.getPage(0))).isBetween(0.24, 0.26);
      assertThat(extractor.largestImageCoverage(document.getPage(1))).isZero();
    }
  }

  @Test
  @DisplayName("Should throw ExtractionException for bytes that are not a PDF")
  void shouldThrowForMalformedPdf() {
    SourcePart part =
        SourcePart.of(
            "broken.pdf", "application/pdf", "not a pdf".getBytes(StandardCharsets.UTF_8));

    assertThatThrownBy(() -> extractor.extract(part))
        .isInstanceOf(ExtractionException.class)
        .hasMessageContaining("broken.pdf");
  }

  /** Builds a PDF whose first page holds an image scaled to {@code imageScale} of each side. */
  private static byte[] buildPdf(double imageScale, String secondPageText) throws IOException {
    try (PDDocument document = new PDDocument();
        ByteArrayOutputStream out = new ByteArrayOutputStream()) {
      PDRectangle size = PDRectangle.A4;

      PDPage scanned = new PDPage(size);
      document.addPage(scanned);
      BufferedImage image = new BufferedImage(64, 64, BufferedImage.TYPE_INT_RGB);
      Graphics2D graphics = image.createGraphics();
      graphics.setColor(Color.WHITE);
      graphics.fillRect(0, 0, 64, 64);
      graphics.dispose();
      PDImageXObject xObject = LosslessFactory.createFromImage(document, image);
      float width = (float) (size.getWidth() * imageScale);
      float height = (float) (size.getHeight() * imageScale);
      try (PDPageContentStream content = new PDPageContentStream(document, scanned)) {
        content.drawImage(xObject, 10, 10, width, height);
      }

      PDPage text = new PDPage(size);
      document.addPage(text);
      try (PDPageContentStream content = new PDPageContentStream(document, text)) {
        content.beginText();
        content.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
        content.newLineAtOffset(72, 700);
        content.showText(secondPageText);
        content.endText();
      }

      document.save(out);
      return out.toByteArray();
    }
  }
}
