package com.kotsin.hotspot.tracking;

import com.kotsin.hotspot.model.EventTrend;
import com.kotsin.hotspot.model.HistoryPoint;

import java.util.List;

import static com.kotsin.hotspot.config.ProcessingConstants.*;

/**
 * TrendEngine - Two-point relative-change trend over an event's history.
 *
 * I = frpSum + 0.6·frpMax + 0.25·focusCount for the last two snapshots a, b.
 * pct = (I_b − I_a) / I_a (0 when I_a = 0); rising above +15%, falling below −15%.
 */
public class TrendEngine {

    public EventTrend evaluate(List<HistoryPoint> history) {
        if (history == null || history.size() < 2) {
            return EventTrend.STABLE;
        }

        double ia = intensity(history.get(history.size() - 2));
        double ib = intensity(history.get(history.size() - 1));

        double pct = ia == 0.0 ? 0.0 : (ib - ia) / ia;
        if (pct > TREND_CHANGE_THRESHOLD) {
            return EventTrend.RISING;
        }
        if (pct < -TREND_CHANGE_THRESHOLD) {
            return EventTrend.FALLING;
        }
        return EventTrend.STABLE;
    }

    /**
     * Composite intensity of one snapshot; missing fields count as 0.
     */
    public double intensity(HistoryPoint point) {
        if (point == null) {
            return 0.0;
        }
        double frpSum = point.getFrpSum() == null ? 0.0 : point.getFrpSum();
        double frpMax = point.getFrpMax() == null ? 0.0 : point.getFrpMax();
        double focus = point.getFocusCount() == null ? 0.0 : point.getFocusCount();
        return frpSum + TREND_FRP_MAX_WEIGHT * frpMax + TREND_FOCUS_COUNT_WEIGHT * focus;
    }
}
