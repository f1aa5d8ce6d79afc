package org.example.course.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public class Block {

    private String id;
    private BlockType type;
    private String title;
    private String purpose;
    private int order;
    private GenerationStatus contentStatus = GenerationStatus.PENDING;
    private String contentError;
    private BlockContent content;

    public Block() {}

    public Block(String id, BlockType type, String title, String purpose, int order) {
        this.id = id;
        this.type = type;
        this.title = title;
        this.purpose = purpose;
        this.order = order;
    }

    @JsonIgnore
    public boolean isContentReady() {
        return contentStatus == GenerationStatus.READY && content != null;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public BlockType getType() { return type; }
    public void setType(BlockType type) { this.type = type; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getPurpose() { return purpose; }
    public void setPurpose(String purpose) { this.purpose = purpose; }

    public int getOrder() { return order; }
    public void setOrder(int order) { this.order = order; }

    public GenerationStatus getContentStatus() { return contentStatus; }
    public void setContentStatus(GenerationStatus contentStatus) { this.contentStatus = contentStatus; }

    public String getContentError() { return contentError; }
    public void setContentError(String contentError) { this.contentError = contentError; }

    public BlockContent getContent() { return content; }

    public void setContent(BlockContent content) {
        if (content != null && type != null && content.blockType() != type) {
            throw new IllegalArgumentException(
                    "Content of type " + content.blockType().value() + " does not match block type " + type.value());
        }
        this.content = content;
    }
}
