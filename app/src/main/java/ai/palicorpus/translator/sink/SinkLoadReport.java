package ai.palicorpus.translator.sink;

public record SinkLoadReport(int collections, int books, int chapters, int sections) {
}
