// ResourceReference.java
// one stored object as handed over by the booking/resource store; may be
// one uploaded part of a larger logical file

package limited.theta.overlay;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.json.JSONArray;
import org.json.JSONObject;

public final class ResourceReference
{
    public static final int NO_PART_INDEX = -1;

    private final String primaryUrl;
    private final List<String> alternateKeys;
    private final String contentTypeHint;
    private final long sizeHint;
    private final int partIndex;
    private final String partGroupId;
    private final String resourceId;
    private final String fileName;

    private ResourceReference(Builder b)
    {
        this.primaryUrl = b.primaryUrl == null ? "" : b.primaryUrl;
        this.alternateKeys = Collections.unmodifiableList(new ArrayList<>(b.alternateKeys));
        this.contentTypeHint = b.contentTypeHint;
        this.sizeHint = b.sizeHint;
        this.partIndex = b.partIndex;
        this.partGroupId = b.partGroupId;
        this.resourceId = b.resourceId;
        this.fileName = b.fileName;
    }

    public static ResourceReference of(String primaryUrl)
    {
        return builder(primaryUrl).build();
    }

    public static Builder builder(String primaryUrl)
    {
        return new Builder(primaryUrl);
    }

    /**
     * Builds a reference from a resource record as the store returns it.
     * Field names vary between producers, so several aliases are read
     * for each field. Returns null when the record carries no URL.
     */
    public static ResourceReference fromJson(JSONObject record)
    {
        if (record == null) {
            return null;
        }
        String url = firstString(record, "ResourceUrl", "resourceUrl", "url", "presignedUrl", "s3Url");
        if (url == null || url.isEmpty()) {
            return null;
        }
        Builder b = builder(url)
            .resourceId(firstString(record, "ResourceId", "resourceId", "id"))
            .fileName(firstString(record, "FileName", "fileName", "name"))
            .contentTypeHint(firstString(record, "ContentType", "contentType", "type"))
            .sizeHint(record.optLong("Size", record.optLong("size", 0L)));

        String group = firstString(record, "partGroupId", "PartGroupId", "chunkGroupId");
        if (group != null) {
            b.partGroupId(group);
        }
        int index = record.optInt("partIndex", record.optInt("PartIndex", NO_PART_INDEX));
        if (index >= 0) {
            b.partIndex(index);
        }

        JSONArray alternates = record.optJSONArray("alternateKeys");
        if (alternates != null) {
            for (int i = 0; i < alternates.length(); i++) {
                String key = alternates.optString(i, null);
                if (key != null && !key.isEmpty()) {
                    b.alternateKey(key);
                }
            }
        }
        String s3Key = firstString(record, "s3Key", "S3Key", "key");
        if (s3Key != null && !s3Key.isEmpty()) {
            b.alternateKey(s3Key);
        }
        return b.build();
    }

    private static String firstString(JSONObject record, String... names)
    {
        for (String name : names) {
            Object v = record.opt(name);
            if (v != null && v != JSONObject.NULL) {
                String s = v.toString().trim();
                if (!s.isEmpty()) {
                    return s;
                }
            }
        }
        return null;
    }

    public String getPrimaryUrl() { return primaryUrl; }
    public List<String> getAlternateKeys() { return alternateKeys; }
    public String getContentTypeHint() { return contentTypeHint; }
    public long getSizeHint() { return sizeHint; }
    public String getResourceId() { return resourceId; }

    public boolean hasPartIndex() { return partIndex != NO_PART_INDEX; }
    public int getPartIndex() { return partIndex; }
    public String getPartGroupId() { return partGroupId; }

    /** Declared file name, or the decoded last path segment of the URL. */
    public String getFileName()
    {
        if (fileName != null && !fileName.isEmpty()) {
            return fileName;
        }
        return ResourceLocator.fileNameOf(primaryUrl);
    }

    @Override
    public boolean equals(Object o)
    {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ResourceReference)) {
            return false;
        }
        ResourceReference other = (ResourceReference) o;
        return sizeHint == other.sizeHint
            && partIndex == other.partIndex
            && primaryUrl.equals(other.primaryUrl)
            && alternateKeys.equals(other.alternateKeys)
            && Objects.equals(contentTypeHint, other.contentTypeHint)
            && Objects.equals(partGroupId, other.partGroupId)
            && Objects.equals(resourceId, other.resourceId)
            && Objects.equals(fileName, other.fileName);
    }

    @Override
    public int hashCode()
    {
        return Objects.hash(primaryUrl, alternateKeys, contentTypeHint, sizeHint,
                            partIndex, partGroupId, resourceId, fileName);
    }

    @Override
    public String toString()
    {
        return "ResourceReference(" + SignedUrls.redact(primaryUrl)
            + (hasPartIndex() ? ", part " + partIndex : "")
            + (partGroupId == null ? "" : ", group " + partGroupId) + ")";
    }

    public static final class Builder
    {
        private final String primaryUrl;
        private final List<String> alternateKeys = new ArrayList<>();
        private String contentTypeHint;
        private long sizeHint;
        private int partIndex = NO_PART_INDEX;
        private String partGroupId;
        private String resourceId;
        private String fileName;

        private Builder(String primaryUrl)
        {
            this.primaryUrl = primaryUrl;
        }

        public Builder alternateKey(String key) { alternateKeys.add(key); return this; }
        public Builder contentTypeHint(String type) { contentTypeHint = type; return this; }
        public Builder sizeHint(long size) { sizeHint = size; return this; }
        public Builder partGroupId(String id) { partGroupId = id; return this; }
        public Builder resourceId(String id) { resourceId = id; return this; }
        public Builder fileName(String name) { fileName = name; return this; }

        public Builder partIndex(int index)
        {
            if (index < 0) {
                throw new IllegalArgumentException("partIndex must be >= 0, was " + index);
            }
            partIndex = index;
            return this;
        }

        public ResourceReference build()
        {
            return new ResourceReference(this);
        }
    }

} // ResourceReference
