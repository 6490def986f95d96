package com.glimpse.core.io;

import com.glimpse.core.image.Frame;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.ImageTypeSpecifier;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.metadata.IIOInvalidTreeException;
import javax.imageio.metadata.IIOMetadata;
import javax.imageio.metadata.IIOMetadataNode;
import javax.imageio.stream.ImageInputStream;
import javax.imageio.stream.ImageOutputStream;
import java.awt.AlphaComposite;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Animated GIF support on top of the JDK GIF plugin. Frames are composited onto the logical
 * screen so every decoded frame is a full picture.
 */
final class GifCodec {

    private static final String IMAGE_METADATA_FORMAT = "javax_imageio_gif_image_1.0";
    private static final String STREAM_METADATA_FORMAT = "javax_imageio_gif_stream_1.0";

    private GifCodec() {
    }

    static List<Frame> decode(Path path) throws IOException {
        try (ImageInputStream input = ImageIO.createImageInputStream(path.toFile())) {
            if (input == null) {
                throw new DecodeException(path, "Cannot open " + path.getFileName());
            }
            Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName("gif");
            if (!readers.hasNext()) {
                throw new DecodeException(path, "No GIF reader available");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, false);
                return readFrames(reader);
            } finally {
                reader.dispose();
            }
        }
    }

    private static List<Frame> readFrames(ImageReader reader) throws IOException {
        int count = reader.getNumImages(true);
        int[] screen = logicalScreenSize(reader.getStreamMetadata());
        List<Frame> frames = new ArrayList<>(count);
        BufferedImage canvas = null;

        for (int i = 0; i < count; i++) {
            BufferedImage raw = reader.read(i);
            FrameInfo info = frameInfo(reader.getImageMetadata(i));
            if (canvas == null) {
                int width = Math.max(screen[0], info.left() + raw.getWidth());
                int height = Math.max(screen[1], info.top() + raw.getHeight());
                canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
            }
            BufferedImage previous = "restoreToPrevious".equals(info.disposal()) ? copyOf(canvas) : null;

            Graphics2D g = canvas.createGraphics();
            try {
                g.drawImage(raw, info.left(), info.top(), null);
            } finally {
                g.dispose();
            }
            frames.add(new Frame(copyOf(canvas), count > 1 ? info.delayMillis() : 0));

            if ("restoreToBackgroundColor".equals(info.disposal())) {
                Graphics2D clear = canvas.createGraphics();
                try {
                    clear.setComposite(AlphaComposite.Clear);
                    clear.fillRect(info.left(), info.top(), raw.getWidth(), raw.getHeight());
                } finally {
                    clear.dispose();
                }
            } else if (previous != null) {
                canvas = previous;
            }
        }
        return List.copyOf(frames);
    }

    static void encode(OutputStream out, List<Frame> frames) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("gif");
        if (!writers.hasNext()) {
            throw new EncodeException("No GIF writer available");
        }
        ImageWriter writer = writers.next();
        try (ImageOutputStream output = ImageIO.createImageOutputStream(out)) {
            writer.setOutput(output);
            ImageWriteParam param = writer.getDefaultWriteParam();
            writer.prepareWriteSequence(null);
            boolean first = true;
            for (Frame frame : frames) {
                BufferedImage image = frame.image();
                IIOMetadata metadata = writer.getDefaultImageMetadata(
                    ImageTypeSpecifier.createFromRenderedImage(image), param);
                configureFrame(metadata, frame.delayMillis(), first && frames.size() > 1);
                writer.writeToSequence(new IIOImage(image, null, metadata), param);
                first = false;
            }
            writer.endWriteSequence();
        } finally {
            writer.dispose();
        }
    }

    private static void configureFrame(IIOMetadata metadata, int delayMillis, boolean loop)
        throws IIOInvalidTreeException {
        IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(IMAGE_METADATA_FORMAT);
        IIOMetadataNode control = child(root, "GraphicControlExtension");
        control.setAttribute("disposalMethod", "restoreToBackgroundColor");
        control.setAttribute("userInputFlag", "FALSE");
        control.setAttribute("transparentColorFlag", "FALSE");
        control.setAttribute("delayTime", Integer.toString(Math.max(0, delayMillis / 10)));
        control.setAttribute("transparentColorIndex", "0");

        if (loop) {
            IIOMetadataNode extensions = child(root, "ApplicationExtensions");
            IIOMetadataNode netscape = new IIOMetadataNode("ApplicationExtension");
            netscape.setAttribute("applicationID", "NETSCAPE");
            netscape.setAttribute("authenticationCode", "2.0");
            netscape.setUserObject(new byte[]{0x1, 0x0, 0x0});
            extensions.appendChild(netscape);
        }
        metadata.setFromTree(IMAGE_METADATA_FORMAT, root);
    }

    private static IIOMetadataNode child(IIOMetadataNode root, String name) {
        NodeList nodes = root.getElementsByTagName(name);
        if (nodes.getLength() > 0) {
            return (IIOMetadataNode) nodes.item(0);
        }
        IIOMetadataNode node = new IIOMetadataNode(name);
        root.appendChild(node);
        return node;
    }

    private static int[] logicalScreenSize(IIOMetadata streamMetadata) {
        if (streamMetadata == null) {
            return new int[]{0, 0};
        }
        Node root = streamMetadata.getAsTree(STREAM_METADATA_FORMAT);
        for (Node node = root.getFirstChild(); node != null; node = node.getNextSibling()) {
            if ("LogicalScreenDescriptor".equals(node.getNodeName())) {
                IIOMetadataNode descriptor = (IIOMetadataNode) node;
                return new int[]{
                    parseInt(descriptor.getAttribute("logicalScreenWidth")),
                    parseInt(descriptor.getAttribute("logicalScreenHeight"))
                };
            }
        }
        return new int[]{0, 0};
    }

    private static FrameInfo frameInfo(IIOMetadata metadata) {
        int left = 0;
        int top = 0;
        int delay = 0;
        String disposal = "none";
        IIOMetadataNode root = (IIOMetadataNode) metadata.getAsTree(IMAGE_METADATA_FORMAT);
        NodeList descriptors = root.getElementsByTagName("ImageDescriptor");
        if (descriptors.getLength() > 0) {
            IIOMetadataNode descriptor = (IIOMetadataNode) descriptors.item(0);
            left = parseInt(descriptor.getAttribute("imageLeftPosition"));
            top = parseInt(descriptor.getAttribute("imageTopPosition"));
        }
        NodeList controls = root.getElementsByTagName("GraphicControlExtension");
        if (controls.getLength() > 0) {
            IIOMetadataNode control = (IIOMetadataNode) controls.item(0);
            delay = parseInt(control.getAttribute("delayTime")) * 10;
            disposal = control.getAttribute("disposalMethod");
        }
        return new FrameInfo(left, top, delay, disposal);
    }

    private static int parseInt(String value) {
        try {
            return value == null || value.isBlank() ? 0 : Integer.parseInt(value.trim());
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    private static BufferedImage copyOf(BufferedImage source) {
        BufferedImage copy = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = copy.createGraphics();
        try {
            g.drawImage(source, 0, 0, null);
        } finally {
            g.dispose();
        }
        return copy;
    }

    private record FrameInfo(int left, int top, int delayMillis, String disposal) {
    }
}
