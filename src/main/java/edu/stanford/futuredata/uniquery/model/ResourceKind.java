package edu.stanford.futuredata.uniquery.model;

public enum ResourceKind {
    DOCUMENT("Documents"),
    PARTITION_KEY_RANGE("PartitionKeyRanges"),
    COLLECTION("DocumentCollections"),
    DATABASE("Databases"),
    OFFER("Offers");

    // Field of a feed response body holding the items.
    public final String envelopeField;

    ResourceKind(String envelopeField) {
        this.envelopeField = envelopeField;
    }
}
