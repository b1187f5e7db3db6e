package com.knowledge.fusion.api;

import com.knowledge.fusion.core.model.Entity;
import com.knowledge.fusion.core.model.ExtractedEntity;
import com.knowledge.fusion.core.model.ExtractedRelation;
import com.knowledge.fusion.core.model.Relation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns extractor mentions into canonical entity and relation candidates.
 *
 * <p>Every entity mention becomes its own candidate (deduplication is left to the
 * fusion engines). The extractor confidence is kept as the {@code confidence}
 * property and the context as the {@code context} property. Relation endpoints are
 * resolved by surface text against the mentions of the same batch; the first
 * mention of a text wins.</p>
 */
public class CandidateMapper {
    private static final Logger log = LoggerFactory.getLogger(CandidateMapper.class);

    public Entity mapEntity(ExtractedEntity mention) {
        Entity.Builder builder = Entity.builder()
                .name(mention.text())
                .type(mention.type())
                .property(Entity.CONFIDENCE_PROPERTY, mention.confidence());
        if (mention.context() != null && !mention.context().isEmpty()) {
            builder.property("context", mention.context());
        }
        return builder.build();
    }

    public MappedCandidates map(List<ExtractedEntity> entityMentions, List<ExtractedRelation> relationMentions) {
        List<Entity> entities = new ArrayList<>(entityMentions.size());
        Map<String, String> idsByText = new HashMap<>();
        for (ExtractedEntity mention : entityMentions) {
            Entity entity = mapEntity(mention);
            entities.add(entity);
            idsByText.putIfAbsent(mention.text(), entity.getId());
        }

        List<Relation> relations = new ArrayList<>(relationMentions.size());
        List<ExtractedRelation> unresolved = new ArrayList<>();
        for (ExtractedRelation mention : relationMentions) {
            String head = idsByText.get(mention.headEntity());
            String tail = idsByText.get(mention.tailEntity());
            if (head == null || tail == null) {
                unresolved.add(mention);
                continue;
            }
            Relation.Builder builder = Relation.builder()
                    .type(mention.relationType())
                    .headEntityId(head)
                    .tailEntityId(tail)
                    .confidence(mention.confidence());
            if (mention.context() != null && !mention.context().isEmpty()) {
                builder.property(Relation.CONTEXT_PROPERTY, mention.context());
            }
            relations.add(builder.build());
        }
        if (!unresolved.isEmpty()) {
            log.warn("mapping.relations.unresolved count={}", unresolved.size());
        }
        return new MappedCandidates(entities, relations, unresolved);
    }
}
