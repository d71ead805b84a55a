package com.enterprise.jobscheduling.persistence;

import java.util.List;

/**
 * One page of a listing
 */
public final class Page<T> {
    
    private final List<T> items;
    private final int page;
    private final int pageSize;
    private final long totalItems;
    
    public Page(List<T> items, int page, int pageSize, long totalItems) {
        this.items = List.copyOf(items);
        this.page = page;
        this.pageSize = pageSize;
        this.totalItems = totalItems;
    }
    
    public List<T> getItems() { return items; }
    public int getPage() { return page; }
    public int getPageSize() { return pageSize; }
    public long getTotalItems() { return totalItems; }
    
    public int getTotalPages() {
        return (int) ((totalItems + pageSize - 1) / pageSize);
    }
    
    public boolean hasNext() {
        return page + 1 < getTotalPages();
    }
}
