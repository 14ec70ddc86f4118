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
package edu.ucr.cs.bdlab.colortiles.raptor;

import java.awt.geom.AffineTransform;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * This exception is thrown when the GeoTIFF tags of a file cannot be interpreted, e.g., a file without
 * georeferencing or with an unsupported raster to model transform. Its message includes a dump of all the
 * georeferencing tags so that the offending configuration can be identified.
 *
 * @author Bryce Nordgren / USDA Forest Service
 * @author Simone Giannecchini
 */
public final class GeoTiffException extends IOException {

    private static final long serialVersionUID = 1008533682021487024L;

    private final transient GeoTiffMetadata metadata;

    /**
     * Constructs an instance of <code>GeoTiffException</code> with the specified detail message.
     *
     * @param metadata The metadata from the GeoTIFF image causing the error.
     * @param msg the detail message.
     * @param t the underlying exception to include
     */
    public GeoTiffException(GeoTiffMetadata metadata, String msg, Throwable t) {
        super(msg);
        this.metadata = metadata;
        if (t != null) this.initCause(t);
    }

    /**
     * The detail message without the dump of the tags
     * @return the message given to the constructor
     */
    public String getShortMessage() {
        return super.getMessage();
    }

    public AffineTransform getModelTransformation() {
        if (metadata != null) return metadata.getModelTransformation();
        return null;
    }

    public GeoKeyEntry[] getGeoKeys() {
        return metadata != null
                ? metadata.getGeoKeys().toArray(new GeoKeyEntry[0])
                : null;
    }

    public String getMessage() {
        final StringWriter text = new StringWriter(1024);
        final PrintWriter message = new PrintWriter(text);

        // start with the message the user specified
        message.println(super.getMessage());

        // do the model pixel scale tags
        message.print("ModelPixelScaleTag: ");
        final PixelScale modelPixelScales = metadata != null ? metadata.getModelPixelScales() : null;
        message.println(modelPixelScales != null ? modelPixelScales.toString() : "NOT AVAILABLE");

        // do the model tie point tags
        message.print("ModelTiePointTag: ");
        final TiePoint[] modelTiePoints = metadata != null ? metadata.getModelTiePoints() : null;
        if (modelTiePoints != null) {
            message.println("(" + modelTiePoints.length + " tie points)");
            for (int i = 0; i < modelTiePoints.length; i++)
                message.println("TP #" + i + ": " + modelTiePoints[i]);
        } else {
            message.println("NOT AVAILABLE");
        }

        // do the transformation tag
        message.print("ModelTransformationTag: ");
        AffineTransform modelTransformation = getModelTransformation();
        if (modelTransformation != null) {
            message.print("[" + modelTransformation.getScaleX());
            message.print("," + modelTransformation.getShearX());
            message.print("," + modelTransformation.getTranslateX());
            message.print("," + modelTransformation.getShearY());
            message.print("," + modelTransformation.getScaleY());
            message.println("," + modelTransformation.getTranslateY() + "]");
        } else {
            message.println("NOT AVAILABLE");
        }

        // do all the GeoKeys
        if (metadata != null) {
            int i = 1;
            for (GeoKeyEntry geokey : metadata.getGeoKeys()) {
                message.println("GeoKey #" + i + ": Key = " + geokey.getKeyID()
                        + ", Value = " + metadata.getGeoKey(geokey.getKeyID()));
                i++;
            }
        }

        message.close();
        return text.toString();
    }
}
