package rsv.utils;

import java.io.FileWriter;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

public class Utils {

    public static String getCurrentTimeStamp() {
        DateTimeFormatter dtf = DateTimeFormatter.ofPattern("uuuu/MM/dd HH:mm:ss");
        return dtf.format(LocalDateTime.now());
    }

    public static void logRuntime(String runtimeLogPath, String phase, long elapsedTimeMs, long memoryUsageMb) {
        System.out.println(phase + " completed: " + elapsedTimeMs + "ms | Memory: " + memoryUsageMb + "MB");
        if (runtimeLogPath == null) {
            return;
        }
        try (FileWriter writer = new FileWriter(runtimeLogPath, true)) {
            writer.write(getCurrentTimeStamp() + " | " + phase + " | Time: " + elapsedTimeMs + "ms | Memory: " + memoryUsageMb + "MB\n");
        } catch (IOException e) {
            System.err.println("Error writing runtime log: " + e.getMessage());
        }
    }

    public static long getMemoryUsage() {
        return Runtime.getRuntime().totalMemory() - Runtime.getRuntime().freeMemory();
    }

    public static long calculateElapsedTime(long startTimeNanos) {
        return (System.nanoTime() - startTimeNanos) / 1_000_000;
    }

    public static long calculateMemoryUsage(long startMemory) {
        return (getMemoryUsage() - startMemory) / (1024 * 1024);
    }

    // File-name friendly form of a display name: "LINDAS PROD" -> "lindas_prod".
    public static String slug(String name) {
        String slug = name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        slug = slug.replaceAll("^_+|_+$", "");
        return slug.isEmpty() ? "store" : slug;
    }
}
