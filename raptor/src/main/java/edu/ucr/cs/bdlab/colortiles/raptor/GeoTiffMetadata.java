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

import javax.imageio.plugins.tiff.TIFFDirectory;
import javax.imageio.plugins.tiff.TIFFField;
import javax.imageio.plugins.tiff.TIFFTag;
import java.awt.geom.AffineTransform;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

/**
 *  Georeferencing information of a GeoTIFF file. It stores the keys found under the GeoKeyDirectoryTag along with
 *  the tie points, pixel scale, model transformation, and the GDAL no-data tag.
 *
 *  This class is designed based on GeoTiffIIOMetadataDecoder from GeoTools library.
 */
public class GeoTiffMetadata {

    public static final int TAG_MODEL_PIXEL_SCALE = 33550;
    public static final int TAG_MODEL_TIE_POINT = 33922;
    public static final int TAG_MODEL_TRANSFORMATION = 34264;
    public static final int TAG_GEO_KEY_DIRECTORY = 34735;
    public static final int TAG_GEO_DOUBLE_PARAMS = 34736;
    public static final int TAG_GEO_ASCII_PARAMS = 34737;
    public static final int TIFFTAG_NODATA = 42113;

    public static final int KEY_GT_MODEL_TYPE = 1024;
    public static final int KEY_GT_RASTER_TYPE = 1025;
    public static final int KEY_GEOGRAPHIC_TYPE = 2048;
    public static final int KEY_GEOG_GEODETIC_DATUM = 2050;
    public static final int KEY_PROJECTED_CS_TYPE = 3072;

    public static final int MODEL_TYPE_PROJECTED = 1;
    public static final int MODEL_TYPE_GEOGRAPHIC = 2;
    public static final int RASTER_PIXEL_IS_AREA = 1;
    public static final int RASTER_PIXEL_IS_POINT = 2;
    public static final int USER_DEFINED = 32767;
    public static final int DATUM_WGS84 = 6326;

    /** The TIFF directory that holds all the tags */
    private final TIFFDirectory directory;

    private final Map<Integer, GeoKeyEntry> geoKeys;

    private int geoKeyDirVersion;

    private int geoKeyRevision;

    private int geoKeyMinorRevision;

    private final PixelScale pixelScale;

    private final TiePoint[] tiePoints;

    private final double noData;

    private final AffineTransform modelTransformation;

    public GeoTiffMetadata(TIFFDirectory directory) throws GeoTiffException {
        this.directory = directory;
        geoKeys = new TreeMap<>();

        // 1. Get value associated with GeoKeyDirectoryTag.
        TIFFField entry = directory.getTIFFField(TAG_GEO_KEY_DIRECTORY);
        if (entry != null) {
            // GeoKeyDirectory header  consists of {KeyDirectoryVersion, KeyRevision, MinorRevision, NumberOfKeys}
            if (entry.getCount() < 4)
                throw new GeoTiffException(this, "GeoKey directory is too short", null);
            geoKeyDirVersion = entry.getAsInt(0);
            geoKeyRevision = entry.getAsInt(1);
            geoKeyMinorRevision = entry.getAsInt(2);
            int numberOfKeys = entry.getAsInt(3);
            if (entry.getCount() < 4 + 4 * numberOfKeys)
                throw new GeoTiffException(this, String.format("GeoKey directory declares %d keys but has %d values",
                        numberOfKeys, entry.getCount()), null);

            for (int i = 0; i < numberOfKeys; i++) {
                // next lines of GeoKeyDirectory follows the structure : { KeyID, TIFFTagLocation, Count, Value_Offset }
                int base = 4 + 4 * i;
                int keyID = entry.getAsInt(base);
                GeoKeyEntry directoryEntry = new GeoKeyEntry(
                        keyID,
                        entry.getAsInt(base + 1), // Tiff tag location
                        entry.getAsInt(base + 2), // count
                        entry.getAsInt(base + 3)); // value offset
                geoKeys.putIfAbsent(keyID, directoryEntry);
            }
        }
        pixelScale = calculatePixelScales();
        modelTransformation = calculateModelTransformation();
        tiePoints = calculateTiePoints();
        noData = calculateNoData();
    }

    private double calculateNoData() throws GeoTiffException {
        TIFFField entry = directory.getTIFFField(TIFFTAG_NODATA);
        if (entry == null)
            return Double.NaN;
        String noDataStr = entry.getType() == TIFFTag.TIFF_ASCII ? entry.getAsString(0) : entry.getValueAsString(0);
        noDataStr = noDataStr.trim();
        if (noDataStr.equalsIgnoreCase("nan"))
            return Double.NaN;
        try {
            return Double.parseDouble(noDataStr);
        } catch (NumberFormatException nfe) {
            throw new GeoTiffException(this, String.format("Invalid no-data value '%s'", noDataStr), nfe);
        }
    }

    /**
     * Gets the model transformation from the appropriate TIFFField
     *
     * <p>Attention, for the moment we support only 2D baseline transformations.
     *
     * @return the transformation, or null if not found
     */
    private AffineTransform calculateModelTransformation() {
        TIFFField entry = directory.getTIFFField(TAG_MODEL_TRANSFORMATION);
        // Since library supports only 2d transform, reading only the required values.
        if (entry == null || entry.getCount() < 8)
            return null;
        return new AffineTransform(
                entry.getAsDouble(0),
                entry.getAsDouble(4),
                entry.getAsDouble(1),
                entry.getAsDouble(5),
                entry.getAsDouble(3),
                entry.getAsDouble(7));
    }

    private TiePoint[] calculateTiePoints() {
        TIFFField entry = directory.getTIFFField(TAG_MODEL_TIE_POINT);
        if (entry == null)
            return null;
        int numTiePoints = entry.getCount() / 6;
        final TiePoint[] retVal = new TiePoint[numTiePoints];
        for (int i = 0; i < numTiePoints; i++) {
            retVal[i] = new TiePoint(
                    entry.getAsDouble(i * 6),
                    entry.getAsDouble(i * 6 + 1),
                    entry.getAsDouble(i * 6 + 2),
                    entry.getAsDouble(i * 6 + 3),
                    entry.getAsDouble(i * 6 + 4),
                    entry.getAsDouble(i * 6 + 5));
        }
        return retVal;
    }

    private PixelScale calculatePixelScales() {
        TIFFField entry = directory.getTIFFField(TAG_MODEL_PIXEL_SCALE);
        if (entry == null)
            return null;
        double[] scale = new double[3];
        for (int i = 0; i < Math.min(3, entry.getCount()); i++)
            scale[i] = entry.getAsDouble(i);
        return new PixelScale(scale[0], scale[1], scale[2]);
    }

    /**
     * Gets the version of the GeoKey directory. This is typically a value of 1 and can be used to
     * check that the data is of a valid format.
     * @return the directory version index as an integer
     */
    public int getGeoKeyDirectoryVersion() {
        return geoKeyDirVersion;
    }

    public int getGeoKeyRevision() {
        return geoKeyRevision;
    }

    public int getGeoKeyMinorRevision() {
        return geoKeyMinorRevision;
    }

    /**
     * Gets a GeoKey value as a String.
     *
     * @param keyID The numeric ID of the GeoKey
     * @return A string representing the value, or null if the key was not found.
     */
    public String getGeoKey(final int keyID) {
        final GeoKeyEntry rec = getGeoKeyRecord(keyID);
        if (rec == null)
            return null;
        if (rec.getTiffTagLocation() == 0) {
            // value is stored directly in the GeoKey record
            return String.valueOf(rec.getValueOffset());
        }

        // value is stored externally in another TIFF field
        TIFFField field = directory.getTIFFField(rec.getTiffTagLocation());
        if (field == null)
            return null;
        if (field.getType() == TIFFTag.TIFF_ASCII)
            return getTiffAscii(field.getAsString(0), rec.getValueOffset(), rec.getCount());
        if (rec.getValueOffset() >= field.getCount())
            return null;
        return field.getValueAsString(rec.getValueOffset());
    }

    /**
     * Gets a GeoKey value as an integer
     * @param keyID the numeric ID of the GeoKey
     * @param defaultValue the value to return if the key is not found
     * @return the value of the key
     * @throws GeoTiffException if the value of the key is not a number
     */
    public int getGeoKeyAsInt(int keyID, int defaultValue) throws GeoTiffException {
        String value = getGeoKey(keyID);
        if (value == null)
            return defaultValue;
        try {
            return (int) Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new GeoTiffException(this, String.format("GeoKey %d has a non-numeric value '%s'", keyID, value), e);
        }
    }

    /**
     * Gets a record containing the four values of a geokey entry.
     *
     * @param keyID the ID of the key to read
     * @return the record with the given keyID, or null if none is found
     */
    public GeoKeyEntry getGeoKeyRecord(int keyID) {
        return geoKeys.get(keyID);
    }

    /**
     * Gets a portion of a TIFFAscii string with the specified start character and length.
     * GeoTIFF places a vertical bar '|' in place of the null delimiter which is dropped here.
     */
    private static String getTiffAscii(String value, int start, int length) {
        if (start >= value.length())
            return null;
        int end = Math.min(value.length(), start + Math.max(0, length - 1));
        String str = value.substring(start, end);
        return str.endsWith("|") ? str.substring(0, str.length() - 1) : str;
    }

    public AffineTransform getModelTransformation() {
        return modelTransformation;
    }

    /**
     * Return the GeoKeys sorted by key ID.
     * @return the collection of all model keys
     */
    public Collection<GeoKeyEntry> getGeoKeys() {
        return geoKeys.values();
    }

    public PixelScale getModelPixelScales() {
        return pixelScale;
    }

    public TiePoint[] getModelTiePoints() {
        return tiePoints;
    }

    /**
     * The no-data value stored in the GDAL_NODATA tag
     * @return the no-data value or NaN if not set
     */
    public double getNoData() {
        return noData;
    }

    public boolean hasTiePoints() {
        return tiePoints != null && tiePoints.length > 0;
    }

    public boolean hasModelTransformation() {
        return modelTransformation != null;
    }

    public boolean hasPixelScales() {
        return pixelScale != null && pixelScale.isSet();
    }

    /**
     * Computes the transformation from grid space (pixel corners) to model space.
     * If the raster type is PixelIsPoint, the tie point refers to pixel centers and the result is shifted by half a
     * pixel.
     * @return the grid to model transformation
     * @throws GeoTiffException if the file has no usable georeferencing
     */
    public AffineTransform getGridToModel() throws GeoTiffException {
        AffineTransform g2m;
        if (hasModelTransformation()) {
            g2m = new AffineTransform(modelTransformation);
        } else if (hasTiePoints() && hasPixelScales()) {
            if (tiePoints.length > 1)
                throw new GeoTiffException(this, "Rasters with multiple tie points are not supported", null);
            TiePoint tp = tiePoints[0];
            double sx = pixelScale.getScaleX();
            double sy = pixelScale.getScaleY();
            g2m = new AffineTransform(sx, 0, 0, -sy, tp.getX() - tp.getI() * sx, tp.getY() + tp.getJ() * sy);
        } else {
            throw new GeoTiffException(this, "No georeferencing information found", null);
        }
        if (getGeoKeyAsInt(KEY_GT_RASTER_TYPE, RASTER_PIXEL_IS_AREA) == RASTER_PIXEL_IS_POINT)
            g2m.translate(-0.5, -0.5);
        return g2m;
    }

    /**
     * The identifier of the coordinate reference system, e.g., "EPSG:4326"
     * @return the identifier or null if the system is not defined by an EPSG code
     * @throws GeoTiffException if the GeoKeys that define the system are malformed
     */
    public String getCRS() throws GeoTiffException {
        int modelType = getGeoKeyAsInt(KEY_GT_MODEL_TYPE, 0);
        if (modelType == MODEL_TYPE_PROJECTED) {
            int code = getGeoKeyAsInt(KEY_PROJECTED_CS_TYPE, USER_DEFINED);
            return code == USER_DEFINED || code == 0 ? null : "EPSG:" + code;
        }
        if (modelType == MODEL_TYPE_GEOGRAPHIC) {
            int code = getGeoKeyAsInt(KEY_GEOGRAPHIC_TYPE, USER_DEFINED);
            if (code != USER_DEFINED && code != 0)
                return "EPSG:" + code;
            if (getGeoKeyAsInt(KEY_GEOG_GEODETIC_DATUM, 0) == DATUM_WGS84)
                return WebMercator.GeographicCRS;
        }
        return null;
    }
}
