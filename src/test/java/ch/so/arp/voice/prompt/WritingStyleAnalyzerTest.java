package ch.so.arp.voice.prompt;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

class WritingStyleAnalyzerTest {

    private final WritingStyleAnalyzer analyzer = new WritingStyleAnalyzer();

    @Test
    void detectsPunchyCasualWriting() {
        WritingStyleTraits traits = analyzer.analyze(List.of(
                "Hey there! This is gonna be awesome! Ready?\n\n- one\n- two",
                "Short. Sweet. **Bold** moves!"));

        assertThat(traits.sampleCount()).isEqualTo(2);
        assertThat(traits.characteristics()).contains("uses short, punchy sentences",
                "uses exclamation points frequently for emphasis", "uses bold text for emphasis",
                "structures information with lists and bullet points", "uses casual, conversational language");
    }

    @Test
    void detectsProfessionalRegister() {
        String sample = "The committee reviewed the proposal in considerable detail over the course of several "
                + "long meetings with all relevant stakeholders present. However, the available budget was "
                + "insufficient for the full scope, and therefore the project will be delivered in two stages "
                + "over the next two calendar years.";

        WritingStyleTraits traits = analyzer.analyze(List.of(sample));

        assertThat(traits.characteristics()).contains("writes in long, complex sentences",
                "maintains professional vocabulary");
    }

    @Test
    void blankSamplesYieldNoTraits() {
        assertThat(analyzer.analyze(List.of(" ", ""))).isEqualTo(WritingStyleTraits.NONE);
        assertThat(WritingStyleTraits.NONE.isEmpty()).isTrue();
    }
}
