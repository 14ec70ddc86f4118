/*
 * Copyright 2018 University of California, Riverside
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package edu.ucr.cs.bdlab.colortiles.davinci;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;

/**
 * The image formats that tiles can be written in.
 * @author Ahmed Eldawy
 *
 */
public enum ImageOutputFormat {
  PNG("png", ".png", true),
  JPG("jpg", ".jpg", false);

  /**The name of the ImageIO writer*/
  private final String writerName;

  /**The file extension including the dot*/
  private final String extension;

  /**Whether the format keeps the alpha channel*/
  private final boolean supportsAlpha;

  ImageOutputFormat(String writerName, String extension, boolean supportsAlpha) {
    this.writerName = writerName;
    this.extension = extension;
    this.supportsAlpha = supportsAlpha;
  }

  public String getExtension() {
    return extension;
  }

  public boolean supportsAlpha() {
    return supportsAlpha;
  }

  /**
   * Encodes the given image to the output stream. Formats without an alpha channel drop it and keep the color
   * components, which are black for transparent pixels.
   * @param image an ARGB image
   * @param out the stream to write to. It is not closed by this method.
   * @throws IOException if the image cannot be encoded or written
   */
  public void write(BufferedImage image, OutputStream out) throws IOException {
    BufferedImage output = image;
    if (!supportsAlpha) {
      output = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
      int[] argb = image.getRGB(0, 0, image.getWidth(), image.getHeight(), null, 0, image.getWidth());
      output.setRGB(0, 0, image.getWidth(), image.getHeight(), argb, 0, image.getWidth());
    }
    if (!ImageIO.write(output, writerName, out))
      throw new IOException(String.format("No image writer found for format '%s'", writerName));
  }
}
