package org.astroseq.cli;

import java.io.PrintWriter;
import java.time.Duration;

import org.astroseq.engine.IProgressListener;
import org.astroseq.engine.RunResult;

/**
 * Prints a single-line progress bar with throughput and ETA, refreshed at most once per
 * interval.
 */
public class ConsoleProgressListener implements IProgressListener {

    private final PrintWriter out;
    private final long intervalMillis;
    private String label = "";
    private long startTime;
    private long lastUpdate;
    private boolean printed;

    public ConsoleProgressListener(PrintWriter out, Duration interval) {
        this.out = out;
        this.intervalMillis = interval.toMillis();
    }

    @Override
    public synchronized void onStart(String sequenceName, int total) {
        this.label = sequenceName;
        this.startTime = System.currentTimeMillis();
        this.lastUpdate = 0;
        this.printed = false;
    }

    @Override
    public synchronized void onProgress(int completed, int total) {
        long currentTime = System.currentTimeMillis();
        if (completed < total && currentTime - lastUpdate < intervalMillis) {
            return;
        }
        lastUpdate = currentTime;

        long elapsed = Math.max(1, currentTime - startTime);
        double fps = completed > 0 ? (completed * 1000.0) / elapsed : 0;
        long remaining = total > 0 && fps > 0 ? (long) (((total - completed) * 1000.0) / fps) : 0;

        int pct = total > 0 ? (int) ((completed * 100L) / total) : 0;
        int barWidth = 40;
        int filled = total > 0 ? (int) ((completed * (long) barWidth) / total) : 0;
        StringBuilder bar = new StringBuilder("[");
        for (int i = 0; i < barWidth; i++) {
            bar.append(i < filled ? "=" : " ");
        }
        bar.append("]");
        out.print(String.format("\r%s %s %d%% | Frame %d/%d | %.1f fps | Elapsed: %s | ETA: %s",
                label, bar, pct, completed, total, fps, formatTime(elapsed), formatTime(remaining)));
        out.flush();
        printed = true;
    }

    @Override
    public synchronized void onFinish(RunResult result) {
        if (printed) {
            out.println();
            out.flush();
        }
    }

    static String formatTime(long ms) {
        if (ms < 0) {
            return "?";
        }
        long sec = ms / 1000;
        long h = sec / 3600;
        long m = (sec % 3600) / 60;
        long s = sec % 60;
        return h > 0 ? String.format("%d:%02d:%02d", h, m, s) : String.format("%d:%02d", m, s);
    }
}
