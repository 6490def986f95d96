package com.glimpse.core.ops;

import com.glimpse.core.image.Frame;
import com.glimpse.core.image.ImageTransforms;
import com.glimpse.core.io.EncodeException;
import com.glimpse.core.io.ImageCodec;
import com.glimpse.core.io.ImageFormat;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Runs one op on the worker thread against an owned snapshot. Never touches UI state.
 */
final class OpExecutor implements Op.Visitor<Output> {

    private static final Logger LOGGER = Logger.getLogger(OpExecutor.class.getName());

    private final ImageCodec codec;
    private final ClipboardAccess clipboard;
    private final DocumentSnapshot document;
    private final Path navigationTarget;

    OpExecutor(ImageCodec codec, ClipboardAccess clipboard, DocumentSnapshot document, Path navigationTarget) {
        this.codec = codec;
        this.clipboard = clipboard;
        this.document = document;
        this.navigationTarget = navigationTarget;
    }

    @Override
    public Output visitLoadPath(Op.LoadPath op) throws IOException {
        List<Frame> frames = codec.decode(op.path());
        LOGGER.info(() -> "Loaded " + op.path());
        return new Output.ImageLoaded(frames, op.path(), op.selectInList());
    }

    @Override
    public Output visitSave(Op.Save op) throws IOException {
        ImageFormat format = ImageFormat.fromPath(op.path())
            .orElseThrow(() -> new EncodeException("Unknown image format for " + op.path().getFileName()));
        codec.encode(op.path(), format, displayedFrames());
        LOGGER.info(() -> "Saved " + op.path() + " as " + format.name());
        return new Output.Done();
    }

    @Override
    public Output visitNext(Op.Next op) throws IOException {
        return loadNavigationTarget();
    }

    @Override
    public Output visitPrev(Op.Prev op) throws IOException {
        return loadNavigationTarget();
    }

    @Override
    public Output visitRotate(Op.Rotate op) {
        return new Output.Rotate(op.quarterTurns());
    }

    @Override
    public Output visitFlipHorizontal(Op.FlipHorizontal op) {
        return new Output.FlipHorizontal();
    }

    @Override
    public Output visitFlipVertical(Op.FlipVertical op) {
        return new Output.FlipVertical();
    }

    @Override
    public Output visitCrop(Op.Crop op) {
        List<Frame> cropped = ImageTransforms.crop(displayedFrames(), op.rect());
        return new Output.Crop(cropped, document.rotation());
    }

    @Override
    public Output visitResize(Op.Resize op) {
        boolean sideways = ImageTransforms.normalizeQuarterTurns(document.rotation()) % 2 != 0;
        int width = sideways ? op.height() : op.width();
        int height = sideways ? op.width() : op.height();
        return new Output.Resize(ImageTransforms.resize(document.frames(), width, height, op.filter()));
    }

    @Override
    public Output visitColor(Op.Color op) {
        return new Output.Color(ImageTransforms.adjustColor(document.frames(), op.adjustment()));
    }

    @Override
    public Output visitCopy(Op.Copy op) throws IOException {
        clipboard.writeImage(displayedFrames().get(0).image());
        return new Output.Done();
    }

    @Override
    public Output visitPaste(Op.Paste op) throws IOException {
        return new Output.ImageLoaded(List.of(Frame.still(clipboard.readImage())), null, false);
    }

    @Override
    public Output visitUndo(Op.Undo op) {
        return new Output.Undo();
    }

    @Override
    public Output visitRedo(Op.Redo op) {
        return new Output.Redo();
    }

    @Override
    public Output visitClose(Op.Close op) {
        return new Output.Close();
    }

    private Output loadNavigationTarget() throws IOException {
        if (navigationTarget == null) {
            throw new IllegalStateException("Navigation without a resolved target");
        }
        return new Output.ImageLoaded(codec.decode(navigationTarget), navigationTarget, false);
    }

    private List<Frame> displayedFrames() {
        return ImageTransforms.rotate(document.frames(), document.rotation());
    }
}
