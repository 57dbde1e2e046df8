package celldsl;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replays the operations of a {@link Command.AddChart} into a {@link ChartSpec}, substituting every
 * {@link ChartRef} found in series options, at any depth, with its address.
 */
final class ChartInterpreter implements ChartOperation.Visitor<Void> {

    private final ChartSpec spec;
    private final Map<String, String> refs;

    private ChartInterpreter(Command.AddChart chart) {
        this.spec = new ChartSpec(chart.kind, chart.subtype);
        this.refs = chart.resolvedRefs;
    }

    static ChartSpec interpret(Command.AddChart chart) {
        ChartInterpreter in = new ChartInterpreter(chart);
        for (ChartOperation op : chart.operations) {
            op.accept(in);
        }
        return in.spec;
    }

    Object substitute(Object value) {
        if (value instanceof ChartRef) {
            String name = ((ChartRef) value).name;
            String address = refs.get(name);
            if (address == null) {
                throw new ReferenceException("Forward reference " + name + " is not defined, known: " + refs.keySet());
            }
            return address;
        }
        if (value instanceof Map) {
            Map<Object, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                out.put(e.getKey(), substitute(e.getValue()));
            }
            return out;
        }
        if (value instanceof List) {
            List<Object> out = new ArrayList<>();
            for (Object o : (List<?>) value) {
                out.add(substitute(o));
            }
            return out;
        }
        return value;
    }

    @Override
    public Void visitAddSeries(ChartOperation.AddSeries op) {
        Map<String, Object> options = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : op.options.entrySet()) {
            options.put(e.getKey(), substitute(e.getValue()));
        }
        spec.series.add(new ChartSpec.Series(options));
        return null;
    }

    @Override
    public Void visitSetTitle(ChartOperation.SetTitle op) {
        spec.title = op.title;
        return null;
    }

    @Override
    public Void visitSetLegend(ChartOperation.SetLegend op) {
        spec.legendPosition = op.position;
        return null;
    }

    @Override
    public Void visitSetStyle(ChartOperation.SetStyle op) {
        spec.varyColors = op.varyColors;
        return null;
    }

    @Override
    public Void visitShowBlanksAs(ChartOperation.ShowBlanksAs op) {
        spec.blanksAs = op.mode;
        return null;
    }

    @Override
    public Void visitShowHiddenData(ChartOperation.ShowHiddenData op) {
        spec.showHiddenData = op.show;
        return null;
    }

    @Override
    public Void visitCombine(ChartOperation.Combine op) {
        spec.combined.add(interpret(op.secondary));
        return null;
    }
}
