package info.isaksson.erland.sttoplcopenxml.emitter;

import info.isaksson.erland.sttoplcopenxml.model.ObjectIdAllocator;

import java.time.LocalDateTime;

/** Options for writing a PLCopen XML project document. */
public final class EmitterOptions {

    public static final String DEFAULT_PRODUCT_NAME = "Machine Expert Logic Builder";
    public static final String DEFAULT_PRODUCT_VERSION = "V22.1.1.0";

    /** Written to {@code fileHeader/@productName}; identifies the importing tool family. */
    public final String productName;
    public final String productVersion;
    public final String companyName;
    public final String author;

    /** Creation and modification time of the document; null means the time of writing. */
    public final LocalDateTime timestamp;

    /** Source of the project object id of the function block. */
    public final ObjectIdAllocator allocator;

    public EmitterOptions(
            String productName,
            String productVersion,
            String companyName,
            String author,
            LocalDateTime timestamp,
            ObjectIdAllocator allocator
    ) {
        this.productName = (productName == null || productName.isBlank()) ? DEFAULT_PRODUCT_NAME : productName.trim();
        this.productVersion = (productVersion == null || productVersion.isBlank()) ? DEFAULT_PRODUCT_VERSION : productVersion.trim();
        this.companyName = companyName == null ? "" : companyName.trim();
        this.author = author == null ? "" : author.trim();
        this.timestamp = timestamp;
        this.allocator = allocator == null ? ObjectIdAllocator.random() : allocator;
    }

    public static EmitterOptions defaults() {
        return new EmitterOptions(null, null, null, null, null, null);
    }

    public EmitterOptions withAuthor(String author) {
        return new EmitterOptions(productName, productVersion, companyName, author, timestamp, allocator);
    }

    public EmitterOptions withCompanyName(String companyName) {
        return new EmitterOptions(productName, productVersion, companyName, author, timestamp, allocator);
    }

    public EmitterOptions withProduct(String productName, String productVersion) {
        return new EmitterOptions(productName, productVersion, companyName, author, timestamp, allocator);
    }

    public EmitterOptions withTimestamp(LocalDateTime timestamp) {
        return new EmitterOptions(productName, productVersion, companyName, author, timestamp, allocator);
    }

    public EmitterOptions withAllocator(ObjectIdAllocator allocator) {
        return new EmitterOptions(productName, productVersion, companyName, author, timestamp, allocator);
    }

    @Override
    public String toString() {
        return "EmitterOptions{" +
                "productName='" + productName + '\'' +
                ", productVersion='" + productVersion + '\'' +
                ", companyName='" + companyName + '\'' +
                ", author='" + author + '\'' +
                ", timestamp=" + timestamp +
                '}';
    }
}
