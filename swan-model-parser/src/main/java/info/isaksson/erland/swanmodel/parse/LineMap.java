package info.isaksson.erland.swanmodel.parse;

import java.util.ArrayList;
import java.util.List;

/** Maps character offsets of a text to 1-based lines and columns. */
final class LineMap {

    private final int[] lineStarts;

    LineMap(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') starts.add(i + 1);
        }
        lineStarts = new int[starts.size()];
        for (int i = 0; i < lineStarts.length; i++) lineStarts[i] = starts.get(i);
    }

    int line(int offset) {
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= offset) lo = mid;
            else hi = mid - 1;
        }
        return lo + 1;
    }

    int column(int offset) {
        return offset - lineStarts[line(offset) - 1] + 1;
    }
}
