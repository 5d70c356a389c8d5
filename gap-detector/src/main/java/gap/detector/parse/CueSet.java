package gap.detector.parse;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

public final class CueSet {
    private final List<Cue> cues;

    private CueSet(List<Cue> cues) {
        this.cues = List.copyOf(cues);
    }

    public static CueSet of(String... terms) {
        return new CueSet(Arrays.stream(terms).map(Cue::of).collect(Collectors.toList()));
    }

    public static CueSet exact(String... terms) {
        return new CueSet(Arrays.stream(terms).map(Cue::exact).collect(Collectors.toList()));
    }

    public List<Cue> cues() {
        return cues;
    }

    public boolean anyIn(String text) {
        return cues.stream().anyMatch(cue -> cue.foundIn(text));
    }

    public int countIn(String text) {
        return (int) cues.stream().filter(cue -> cue.foundIn(text)).count();
    }

    public Optional<Cue> firstIn(String text) {
        return cues.stream().filter(cue -> cue.foundIn(text)).findFirst();
    }

    public List<String> termsIn(String text) {
        return cues.stream().filter(cue -> cue.foundIn(text)).map(Cue::term).toList();
    }

    String alternation() {
        return cues.stream().map(Cue::core).collect(Collectors.joining("|"));
    }
}
