package com.enterprise.jobscheduling.persistence;

import com.enterprise.jobscheduling.core.JobStatus;
import com.enterprise.jobscheduling.core.JobType;

/**
 * Filter and page selection for listing jobs. Null filters match everything.
 */
public final class JobQuery {
    
    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;
    
    private final JobType jobType;
    private final JobStatus status;
    private final int page;
    private final int pageSize;
    
    private JobQuery(JobType jobType, JobStatus status, int page, int pageSize) {
        this.jobType = jobType;
        this.status = status;
        this.page = Math.max(0, page);
        this.pageSize = Math.min(MAX_PAGE_SIZE, Math.max(1, pageSize));
    }
    
    public JobType getJobType() { return jobType; }
    public JobStatus getStatus() { return status; }
    
    /** Zero based page index */
    public int getPage() { return page; }
    
    public int getPageSize() { return pageSize; }
    
    public static JobQuery all() {
        return builder().build();
    }
    
    public static class Builder {
        private JobType jobType;
        private JobStatus status;
        private int page = 0;
        private int pageSize = DEFAULT_PAGE_SIZE;
        
        public Builder jobType(JobType jobType) {
            this.jobType = jobType;
            return this;
        }
        
        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }
        
        public Builder page(int page) {
            this.page = page;
            return this;
        }
        
        public Builder pageSize(int pageSize) {
            this.pageSize = pageSize;
            return this;
        }
        
        public JobQuery build() {
            return new JobQuery(jobType, status, page, pageSize);
        }
    }
    
    public static Builder builder() {
        return new Builder();
    }
}
