package com.bbthechange.retroboard.service;

import com.bbthechange.retroboard.dto.CardQuotaDTO;
import com.bbthechange.retroboard.dto.ReactionQuotaDTO;

/**
 * Per-user, per-board quotas. Counts are computed from stored cards and reactions on each call.
 */
public interface QuotaService {

    CardQuotaDTO getCardQuota(String boardId, String userHash);

    ReactionQuotaDTO getReactionQuota(String boardId, String userHash);
}
