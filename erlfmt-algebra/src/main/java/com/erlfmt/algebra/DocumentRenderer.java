package com.erlfmt.algebra;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 按行宽把文档线性化为文本
 *
 * <p>每个子文档求值为一组候选布局，立即丢弃超宽和被支配（Pareto 意义下）的候选，
 * 因此候选集合很小；共享子文档按节点身份缓存，整体代价接近文档规模的线性。</p>
 */
public final class DocumentRenderer {
    private static final Logger LOG = Logger.getLogger(DocumentRenderer.class.getName());

    private final int width;

    public DocumentRenderer(int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("width must be positive: " + width);
        }
        this.width = width;
    }

    public int getWidth() {
        return width;
    }

    /**
     * 渲染文档
     *
     * @throws IllegalStateException 文档没有任何可用布局（例如对必然换行的内容使用 single_line）
     */
    public String render(Document document) {
        Map<Document, List<Layout>> cache = new IdentityHashMap<>();
        List<Layout> candidates = evaluate(document, cache);
        if (candidates.isEmpty()) {
            throw new IllegalStateException("document has no layout: " + document);
        }
        Layout best = select(candidates);
        if (LOG.isLoggable(Level.FINEST)) {
            LOG.finest("selected layout height=" + best.getHeight() + " width=" + best.getMaxWidth()
                    + " from " + candidates.size() + " candidates");
        }
        return best.print();
    }

    /** 便捷方法：按给定行宽渲染 */
    public static String render(Document document, int width) {
        return new DocumentRenderer(width).render(document);
    }

    private List<Layout> evaluate(Document document, Map<Document, List<Layout>> cache) {
        List<Layout> cached = cache.get(document);
        if (cached != null) {
            return cached;
        }

        List<Layout> result;
        if (document instanceof Document.Text) {
            result = List.of(Layout.text(((Document.Text) document).getText()));
        } else if (document instanceof Document.Combine) {
            Document.Combine combine = (Document.Combine) document;
            List<Layout> lefts = evaluate(combine.getLeft(), cache);
            List<Layout> rights = evaluate(combine.getRight(), cache);
            List<Layout> combined = new ArrayList<>(lefts.size() * rights.size());
            for (Layout left : lefts) {
                for (Layout right : rights) {
                    combined.add(Layout.combine(left, right));
                }
            }
            result = prune(combined);
        } else if (document instanceof Document.Flush) {
            List<Layout> contents = evaluate(((Document.Flush) document).getContent(), cache);
            List<Layout> flushed = new ArrayList<>(contents.size());
            for (Layout content : contents) {
                flushed.add(Layout.flush(content));
            }
            result = prune(flushed);
        } else if (document instanceof Document.Choice) {
            Document.Choice choice = (Document.Choice) document;
            List<Layout> all = new ArrayList<>(evaluate(choice.getPreferred(), cache));
            all.addAll(evaluate(choice.getFallback(), cache));
            result = prune(all);
        } else if (document instanceof Document.SingleLine) {
            List<Layout> contents = evaluate(((Document.SingleLine) document).getContent(), cache);
            List<Layout> flat = new ArrayList<>();
            for (Layout content : contents) {
                if (content.getHeight() == 0) {
                    flat.add(content);
                }
            }
            result = flat;
        } else {
            throw new IllegalArgumentException("unknown document kind: " + document.getClass().getName());
        }

        cache.put(document, result);
        return result;
    }

    /**
     * 丢弃超宽候选（若还有能放下的），再去掉被支配的候选
     */
    private List<Layout> prune(List<Layout> layouts) {
        List<Layout> fitting = new ArrayList<>(layouts.size());
        Layout narrowest = null;
        for (Layout layout : layouts) {
            if (layout.getMaxWidth() <= width) {
                fitting.add(layout);
            } else if (narrowest == null || isNarrower(layout, narrowest)) {
                narrowest = layout;
            }
        }
        if (fitting.isEmpty()) {
            return narrowest == null ? List.of() : List.of(narrowest);
        }

        List<Layout> frontier = new ArrayList<>(fitting.size());
        for (Layout candidate : fitting) {
            boolean dominated = false;
            for (int i = frontier.size() - 1; i >= 0; i--) {
                Layout kept = frontier.get(i);
                if (kept.dominates(candidate)) {
                    dominated = true;
                    break;
                }
                if (candidate.dominates(kept)) {
                    frontier.remove(i);
                }
            }
            if (!dominated) {
                frontier.add(candidate);
            }
        }
        return frontier;
    }

    private Layout select(List<Layout> candidates) {
        Layout best = null;
        for (Layout candidate : candidates) {
            if (best == null) {
                best = candidate;
                continue;
            }
            boolean candidateFits = candidate.getMaxWidth() <= width;
            boolean bestFits = best.getMaxWidth() <= width;
            if (candidateFits != bestFits) {
                if (candidateFits) best = candidate;
            } else if (candidateFits) {
                if (candidate.getHeight() < best.getHeight()
                        || (candidate.getHeight() == best.getHeight() && candidate.getMaxWidth() < best.getMaxWidth())) {
                    best = candidate;
                }
            } else if (isNarrower(candidate, best)) {
                best = candidate;
            }
        }
        return best;
    }

    private static boolean isNarrower(Layout a, Layout b) {
        return a.getMaxWidth() < b.getMaxWidth()
                || (a.getMaxWidth() == b.getMaxWidth() && a.getHeight() < b.getHeight());
    }
}
