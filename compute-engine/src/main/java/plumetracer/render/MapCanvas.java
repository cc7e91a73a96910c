package plumetracer.render;

import org.locationtech.jts.awt.ShapeWriter;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import plumetracer.io.AtomicFileTransaction;

import javax.imageio.ImageIO;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.Shape;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.function.Consumer;

/**
 * Lienzo Java2D sobre una {@link PlateCarreeProjection}. Dibuja geometrías JTS en grados geográficos.
 */
class MapCanvas implements AutoCloseable {

    static final Color OCEAN = new Color(0xD4E4F1);
    static final Color LAND = new Color(0xEFE9DC);
    static final Color COASTLINE = new Color(0x4D4D4D);
    static final Color GRATICULE = new Color(0x9AA5B1);

    private static final double[] WRAP_OFFSETS = {-360.0, 0.0, 360.0};

    private final PlateCarreeProjection projection;
    private final GeometryFactory geometryFactory = new GeometryFactory();
    private final BufferedImage image;
    private final Graphics2D g;

    MapCanvas(PlateCarreeProjection projection) {
        this.projection = projection;
        // RGB sin alfa para que también se pueda escribir en JPEG/BMP
        this.image = new BufferedImage(projection.getWidth(), projection.getHeight(), BufferedImage.TYPE_INT_RGB);
        this.g = image.createGraphics();
        g.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g.setRenderingHint(RenderingHints.KEY_STROKE_CONTROL, RenderingHints.VALUE_STROKE_PURE);
        g.setClip(0, 0, projection.getWidth(), projection.getHeight());
    }

    void fillBackground(Color color) {
        g.setColor(color);
        g.fillRect(0, 0, image.getWidth(), image.getHeight());
    }

    void fill(Geometry geometry, Color color) {
        g.setColor(color);
        draw(geometry, g::fill);
    }

    void stroke(Geometry geometry, Color color, float lineWidth) {
        g.setColor(color);
        g.setStroke(new BasicStroke(lineWidth));
        draw(geometry, g::draw);
    }

    private void draw(Geometry geographic, Consumer<Shape> action) {
        if (geographic.isEmpty()) {
            return;
        }
        Geometry projected = projection.project(geographic);
        for (double offset : WRAP_OFFSETS) {
            ShapeWriter writer = new ShapeWriter(projection.toPixels(offset));
            action.accept(writer.toShape(projected));
        }
    }

    /**
     * Meridianos y paralelos cada {@code step} grados.
     */
    void drawGraticule(double step) {
        for (double lon = -180.0; lon <= 180.0; lon += step) {
            stroke(geometryFactory.createLineString(new Coordinate[]{
                    new Coordinate(lon, -90.0), new Coordinate(lon, 90.0)}), GRATICULE, 0.5f);
        }
        for (double lat = -90.0 + step; lat < 90.0; lat += step) {
            int n = (int) Math.round(360.0 / step) + 1;
            Coordinate[] parallel = new Coordinate[n];
            for (int k = 0; k < n; k++) {
                parallel[k] = new Coordinate(-180.0 + k * step, lat);
            }
            stroke(geometryFactory.createLineString(parallel), GRATICULE, 0.5f);
        }
    }

    void drawTitle(String title) {
        if (title == null || title.isBlank()) {
            return;
        }
        g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, Math.max(12, image.getHeight() / 40)));
        int textWidth = g.getFontMetrics().stringWidth(title);
        int x = Math.max(4, (image.getWidth() - textWidth) / 2);
        int y = g.getFontMetrics().getAscent() + 6;
        g.setColor(Color.WHITE);
        g.fillRect(x - 4, 2, textWidth + 8, y + 4);
        g.setColor(Color.BLACK);
        g.drawString(title, x, y);
    }

    /**
     * Escribe la imagen con el formato que indica la extensión (png si no tiene).
     */
    void write(Path path) throws IOException {
        String format = formatOf(path);
        try (AtomicFileTransaction tx = new AtomicFileTransaction()) {
            Path temp = tx.stage(path);
            if (!ImageIO.write(image, format, temp.toFile())) {
                throw new IOException("ImageIO no tiene escritor para el formato '" + format + "'");
            }
            tx.commit();
        }
    }

    static String formatOf(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return "png";
        }
        String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return ext.equals("jpeg") ? "jpg" : ext;
    }

    @Override
    public void close() {
        g.dispose();
    }
}
