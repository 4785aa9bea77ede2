package io.github.samzhu.quotacycle.service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

import io.github.samzhu.quotacycle.dto.analytics.WindowPoint;

/**
 * 單一配額鍵的速率視窗，保留最近 {@code span} 內的觀測點。
 *
 * <p>僅供速率計算使用，不是權威資料；重置時整個視窗被捨棄。
 * 觀測點依時間遞增加入，早於最新點的樣本會被忽略。
 */
public class TrackerWindow {

    private final Duration span;
    private final Deque<WindowPoint> points = new ArrayDeque<>();

    public TrackerWindow(Duration span) {
        this.span = span;
    }

    /**
     * 加入觀測點並移除超出範圍的舊點。
     *
     * @param timestamp 樣本時間
     * @param consumed 消耗量
     * @return 是否加入
     */
    public synchronized boolean add(Instant timestamp, double consumed) {
        WindowPoint last = points.peekLast();
        if (last != null && !timestamp.isAfter(last.timestamp())) {
            return false;
        }
        points.addLast(new WindowPoint(timestamp, consumed));
        Instant cutoff = timestamp.minus(span);
        while (!points.isEmpty() && points.peekFirst().timestamp().isBefore(cutoff)) {
            points.removeFirst();
        }
        return true;
    }

    public synchronized void clear() {
        points.clear();
    }

    public synchronized int size() {
        return points.size();
    }

    /**
     * 取得目前觀測點的快照（由舊到新）。
     */
    public synchronized List<WindowPoint> snapshot() {
        return List.copyOf(points);
    }

    public Duration span() {
        return span;
    }
}
