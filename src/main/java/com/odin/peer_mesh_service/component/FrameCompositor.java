package com.odin.peer_mesh_service.component;

import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.Rectangle;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

import org.springframework.stereotype.Component;

import com.odin.peer_mesh_service.config.PeerSessionProperties;
import com.odin.peer_mesh_service.dto.ParticipantSnapshot;
import com.odin.peer_mesh_service.dto.SessionSnapshot;
import com.odin.peer_mesh_service.transport.MediaStream;
import com.odin.peer_mesh_service.transport.MediaTrack;
import com.odin.peer_mesh_service.transport.VideoFrameSource;

/**
 * Draws one recording frame from a session snapshot: the local tile first,
 * then every participant in arrival order, each with its name and a badge
 * when it shows a screen, plus the elapsed recording time.
 */
@Component
public class FrameCompositor {

    private static final Color BACKGROUND = new Color(17, 24, 39);
    private static final Color EMPTY_TILE = new Color(31, 41, 55);
    private static final Color LABEL_BACKGROUND = new Color(0, 0, 0, 160);
    private static final Color SCREEN_BADGE = new Color(37, 99, 235);
    private static final Color REC_COLOR = new Color(220, 38, 38);
    private static final int PADDING = 4;

    private final PeerSessionProperties.Recording settings;

    public FrameCompositor(PeerSessionProperties properties) {
        this.settings = properties.getRecording();
    }

    public BufferedImage render(SessionSnapshot snapshot, long elapsedMs) {
        int width = settings.getWidth();
        int height = settings.getHeight();
        BufferedImage canvas = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = canvas.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setColor(BACKGROUND);
            g.fillRect(0, 0, width, height);

            List<Tile> tiles = tiles(snapshot);
            List<Rectangle> cells = GridLayout.cells(tiles.size(), width, height);
            for (int i = 0; i < tiles.size(); i++) {
                drawTile(g, tiles.get(i), cells.get(i));
            }
            drawClock(g, elapsedMs, width);
        } finally {
            g.dispose();
        }
        return canvas;
    }

    private List<Tile> tiles(SessionSnapshot snapshot) {
        List<Tile> tiles = new ArrayList<>();
        MediaStream local = snapshot.isScreenSharing() && snapshot.getScreenStream() != null
                ? snapshot.getScreenStream()
                : snapshot.getLocalStream();
        tiles.add(new Tile(snapshot.getUsername() + " (You)", local, snapshot.isScreenSharing()));
        for (ParticipantSnapshot participant : snapshot.getParticipants()) {
            tiles.add(new Tile(participant.getUsername(), participant.getStream(), participant.isScreenSharing()));
        }
        return tiles;
    }

    private void drawTile(Graphics2D g, Tile tile, Rectangle cell) {
        Rectangle inner = new Rectangle(cell.x + PADDING, cell.y + PADDING,
                cell.width - 2 * PADDING, cell.height - 2 * PADDING);
        BufferedImage frame = currentFrame(tile.stream);
        if (frame != null) {
            g.drawImage(frame, inner.x, inner.y, inner.width, inner.height, null);
        } else {
            g.setColor(EMPTY_TILE);
            g.fillRect(inner.x, inner.y, inner.width, inner.height);
        }

        int fontSize = Math.max(10, inner.height / 14);
        g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, fontSize));
        int labelHeight = fontSize + 8;
        int labelWidth = g.getFontMetrics().stringWidth(tile.label) + 12;
        g.setColor(LABEL_BACKGROUND);
        g.fillRect(inner.x + 6, inner.y + inner.height - labelHeight - 6, labelWidth, labelHeight);
        g.setColor(Color.WHITE);
        g.drawString(tile.label, inner.x + 12, inner.y + inner.height - 12);

        if (tile.screen) {
            String badge = "SCREEN";
            int badgeWidth = g.getFontMetrics().stringWidth(badge) + 12;
            g.setColor(SCREEN_BADGE);
            g.fillRect(inner.x + inner.width - badgeWidth - 6, inner.y + 6, badgeWidth, labelHeight);
            g.setColor(Color.WHITE);
            g.drawString(badge, inner.x + inner.width - badgeWidth, inner.y + 6 + fontSize + 2);
        }
    }

    private void drawClock(Graphics2D g, long elapsedMs, int width) {
        long seconds = Math.max(0, elapsedMs) / 1000;
        String text = String.format("REC %02d:%02d", seconds / 60, seconds % 60);
        g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 18));
        int textWidth = g.getFontMetrics().stringWidth(text);
        g.setColor(LABEL_BACKGROUND);
        g.fillRect(width - textWidth - 36, 8, textWidth + 28, 28);
        g.setColor(REC_COLOR);
        g.fillOval(width - textWidth - 30, 16, 12, 12);
        g.setColor(Color.WHITE);
        g.drawString(text, width - textWidth - 14, 28);
    }

    private static BufferedImage currentFrame(MediaStream stream) {
        if (stream == null) {
            return null;
        }
        for (MediaTrack track : stream.getVideoTracks()) {
            VideoFrameSource source = track.getFrameSource();
            if (source != null && track.isLive() && track.isEnabled()) {
                return source.currentFrame();
            }
        }
        return null;
    }

    private static final class Tile {
        private final String label;
        private final MediaStream stream;
        private final boolean screen;

        private Tile(String label, MediaStream stream, boolean screen) {
            this.label = label;
            this.stream = stream;
            this.screen = screen;
        }
    }
}
