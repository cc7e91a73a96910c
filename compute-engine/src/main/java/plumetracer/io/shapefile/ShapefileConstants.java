package plumetracer.io.shapefile;

/**
 * Constantes del formato ESRI Shapefile (.shp/.shx) y dBase III (.dbf).
 */
final class ShapefileConstants {

    static final int FILE_CODE = 9994;
    static final int VERSION = 1000;
    static final int SHAPE_NULL = 0;
    static final int SHAPE_POLYGON = 5;
    static final int HEADER_BYTES = 100;
    static final int RECORD_HEADER_BYTES = 8;

    static final byte DBF_VERSION = 0x03;
    static final byte DBF_HEADER_TERMINATOR = 0x0D;
    static final byte DBF_EOF = 0x1A;
    static final int DBF_HEADER_BYTES = 32;
    static final int DBF_FIELD_DESCRIPTOR_BYTES = 32;
    static final int DBF_FIELD_NAME_MAX = 10;
    static final char DBF_NUMERIC = 'N';
    static final int DBF_NUMERIC_LENGTH = 24;
    static final int DBF_NUMERIC_DECIMALS = 15;

    static final String WGS84_PRJ = "GEOGCS[\"GCS_WGS_1984\",DATUM[\"D_WGS_1984\","
            + "SPHEROID[\"WGS_1984\",6378137.0,298.257223563]],"
            + "PRIMEM[\"Greenwich\",0.0],UNIT[\"Degree\",0.0174532925199433]]";

    private ShapefileConstants() {
    }

    static String sibling(String shpFileName, String extension) {
        int dot = shpFileName.lastIndexOf('.');
        String base = dot < 0 ? shpFileName : shpFileName.substring(0, dot);
        return base + extension;
    }
}
