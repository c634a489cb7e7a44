package com.vidnyan.tracescan.adapter.out.rule.collection;

import com.vidnyan.tracescan.domain.finding.Severity;
import com.vidnyan.tracescan.domain.rule.AbstractRule;
import com.vidnyan.tracescan.domain.rule.MatchCollector;
import com.vidnyan.tracescan.domain.scan.BlockLocator;
import com.vidnyan.tracescan.domain.scan.CodeBlock;
import com.vidnyan.tracescan.domain.scan.LineWindow;
import com.vidnyan.tracescan.domain.source.SourceFile;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Detects RecyclerView adapter positions used without the {@code NO_POSITION} check.
 * The position is -1 while a layout pass is pending or after the item was removed.
 */
@Component
public class AdapterPositionRule extends AbstractRule {

    public static final String NAME = "adapter-position";

    private static final Pattern POSITION = Pattern.compile(
            "\\b(?:get(?:Binding|Absolute)?AdapterPosition\\s*\\(\\s*\\)|(?:binding|absolute)?[aA]dapterPosition\\b)");
    private static final Pattern GUARD = Pattern.compile(
            "NO_POSITION|[!=]=\\s*-1|>=\\s*0|<\\s*0|>\\s*-1");

    public AdapterPositionRule() {
        super(NAME,
                "Stale adapter position",
                "Compare the position with RecyclerView.NO_POSITION and return early before using it.",
                JAVA_AND_KOTLIN);
    }

    @Override
    protected void scan(SourceFile file, MatchCollector matches) {
        Set<Integer> reportedBlocks = new HashSet<>();
        forEachMatch(file, matches, POSITION, (index, match) -> {
            Optional<CodeBlock> scope = BlockLocator.findEnclosingMethod(file.lines(), index)
                    .or(() -> BlockLocator.findEnclosingBlock(file.lines(), index));
            int blockStart = scope.map(CodeBlock::start).orElse(-1);
            boolean guarded = scope
                    .map(block -> LineWindow.contains(file.lines(), block, GUARD))
                    .orElseGet(() -> LineWindow.contains(file.lines(), index, 3, 3, GUARD));
            if (guarded || !reportedBlocks.add(blockStart)) {
                return;
            }
            matches.report(index, Severity.HIGH, "Adapter position used without a NO_POSITION check");
        });
    }
}
