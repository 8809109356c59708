package skytiles.acquisition.pipeline.steps;

import skytiles.acquisition.pipeline.PermanentStepException;
import skytiles.acquisition.pipeline.PipelineStep;
import skytiles.acquisition.pipeline.StepContext;
import skytiles.acquisition.pipeline.StepException;
import skytiles.acquisition.pipeline.TransientStepException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Trims the black border around the disk, then crops or pads to the georeferencing frame.
 * <p>
 * Pixels with luminance at or below the threshold count as background. A positive crop
 * removes that many pixels from each side; a negative one adds black padding on each side.
 */
public class AdjustStep implements PipelineStep {

    private static final Logger log = LoggerFactory.getLogger(AdjustStep.class);

    private final int cropX;
    private final int cropY;
    private final int threshold;

    public AdjustStep(int cropX, int cropY, int threshold) {
        this.cropX = cropX;
        this.cropY = cropY;
        this.threshold = threshold;
    }

    @Override
    public String name() {
        return "adjust";
    }

    @Override
    public Path destination(StepContext context) {
        return context.artifact("_adjusted.png");
    }

    @Override
    public void execute(StepContext context, Path source, Path destination) throws StepException {
        BufferedImage image;
        try {
            image = ImageIO.read(source.toFile());
        } catch (IOException e) {
            throw new PermanentStepException("cannot decode " + source.getFileName() + ": " + e.getMessage(), e);
        }
        if (image == null) {
            throw new PermanentStepException("not a readable image: " + source.getFileName());
        }

        BufferedImage adjusted = adjust(image);
        try {
            if (!ImageIO.write(adjusted, "png", destination.toFile())) {
                throw new IOException("no PNG writer available");
            }
        } catch (IOException e) {
            throw new TransientStepException("cannot write " + destination + ": " + e.getMessage(), e);
        }
        log.info("Adjusted {}x{} -> {}x{}", image.getWidth(), image.getHeight(),
                adjusted.getWidth(), adjusted.getHeight());
    }

    BufferedImage adjust(BufferedImage image) throws PermanentStepException {
        int[] box = contentBounds(image);
        if (box == null) {
            log.warn("Image has no content above threshold {}, leaving it unchanged", threshold);
            return image;
        }
        BufferedImage result = image.getSubimage(box[0], box[1], box[2] - box[0], box[3] - box[1]);
        result = applyHorizontal(result);
        result = applyVertical(result);
        return result;
    }

    /**
     * @return {left, top, right, bottom} with right/bottom exclusive, or null if all background
     */
    int[] contentBounds(BufferedImage image) {
        int left = Integer.MAX_VALUE;
        int top = Integer.MAX_VALUE;
        int right = -1;
        int bottom = -1;
        for (int y = 0; y < image.getHeight(); y++) {
            for (int x = 0; x < image.getWidth(); x++) {
                if (luminance(image.getRGB(x, y)) > threshold) {
                    left = Math.min(left, x);
                    right = Math.max(right, x);
                    top = Math.min(top, y);
                    bottom = Math.max(bottom, y);
                }
            }
        }
        if (right < 0) {
            return null;
        }
        return new int[]{left, top, right + 1, bottom + 1};
    }

    private BufferedImage applyHorizontal(BufferedImage image) throws PermanentStepException {
        int width = image.getWidth();
        if (cropX > 0) {
            if (2 * cropX >= width) {
                throw new PermanentStepException("crop_x " + cropX + " too large for width " + width);
            }
            return image.getSubimage(cropX, 0, width - 2 * cropX, image.getHeight());
        }
        if (cropX < 0) {
            int pad = -cropX;
            return pad(image, width + 2 * pad, image.getHeight(), pad, 0);
        }
        return image;
    }

    private BufferedImage applyVertical(BufferedImage image) throws PermanentStepException {
        int height = image.getHeight();
        if (cropY > 0) {
            if (2 * cropY >= height) {
                throw new PermanentStepException("crop_y " + cropY + " too large for height " + height);
            }
            return image.getSubimage(0, cropY, image.getWidth(), height - 2 * cropY);
        }
        if (cropY < 0) {
            int pad = -cropY;
            return pad(image, image.getWidth(), height + 2 * pad, 0, pad);
        }
        return image;
    }

    private static BufferedImage pad(BufferedImage image, int width, int height, int offsetX, int offsetY) {
        int type = image.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        BufferedImage canvas = new BufferedImage(width, height, type);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setColor(Color.BLACK);
            g.fillRect(0, 0, width, height);
            g.drawImage(image, offsetX, offsetY, null);
        } finally {
            g.dispose();
        }
        return canvas;
    }

    // ITU-R 601 luma, the same weights as a greyscale conversion
    static int luminance(int rgb) {
        int r = (rgb >> 16) & 0xff;
        int g = (rgb >> 8) & 0xff;
        int b = rgb & 0xff;
        return (r * 299 + g * 587 + b * 114) / 1000;
    }
}
