package com.scholary.langtag.media;

import java.io.IOException;
import java.nio.file.Path;

/** Recognizes text in a rendered subtitle image. */
public interface OcrEngine {

  /**
   * @return recognized text, possibly empty
   * @throws IOException if the OCR tool fails
   */
  String recognize(Path image) throws IOException;
}
