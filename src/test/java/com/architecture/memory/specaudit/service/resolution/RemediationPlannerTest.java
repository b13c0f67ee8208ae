package com.architecture.memory.specaudit.service.resolution;

import com.architecture.memory.specaudit.SpecFixture;
import com.architecture.memory.specaudit.dto.finding.Confidence;
import com.architecture.memory.specaudit.dto.finding.DuplicateCandidate;
import com.architecture.memory.specaudit.dto.resolution.ActionKind;
import com.architecture.memory.specaudit.dto.resolution.Disposition;
import com.architecture.memory.specaudit.dto.resolution.ResolutionQueueItem;
import com.architecture.memory.specaudit.exception.ActionConflictException;
import com.architecture.memory.specaudit.model.AttributeDefinition;
import com.architecture.memory.specaudit.model.NodeType;
import com.architecture.memory.specaudit.model.SchemaGraph;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RemediationPlannerTest {

    @TempDir
    Path specRoot;

    private final RemediationPlanner planner = new RemediationPlanner(SpecFixture.codec());
    private final SchemaFileWriter writer = new NioSchemaFileWriter();
    private final ResolutionQueueItem plainItem = ResolutionQueueItem.builder().position(1).build();

    @Test
    void movesNodeType_rewritingMembershipAndRelationships() {
        SpecFixture fixture = SpecFixture.at(specRoot)
                .predicates("serves", "assigned-to")
                .layer("business", 2, "business.actor", "business.role")
                .layer("application", 4, "application.component", "application.interface")
                .nodeType("business", "actor", "A person or organization that performs business behavior", "name")
                .nodeType("business", "role", "The responsibility for performing specific behavior", "name")
                .nodeType("application", "component", "An encapsulation of application functionality", "name")
                .nodeType("application", "interface", "A point of access to application services", "name")
                .relationship("application.interface", "serves", "business.actor");
        SchemaGraph graph = fixture.load();

        RemediationPlan plan = planner.plan(graph, plainItem, ActionKind.MOVE,
                "Move node type application.interface to layer business");
        plan.getTransaction().apply(writer);

        assertThat(plan.getDisposition()).isEqualTo(Disposition.APPLIED);
        assertThat(fixture.nodePath("application", "interface")).doesNotExist();
        assertThat(fixture.nodePath("business", "interface")).exists();
        assertThat(fixture.relationshipPath("application.interface", "serves", "business.actor")).doesNotExist();
        assertThat(fixture.relationshipPath("business.interface", "serves", "business.actor")).exists();

        SchemaGraph reloaded = fixture.load();
        assertThat(reloaded.getLoadIssues()).isEmpty();
        assertThat(reloaded.findLayer("business").orElseThrow().getNodeTypeIds())
                .containsExactly("business.actor", "business.interface", "business.role");
        assertThat(reloaded.findLayer("application").orElseThrow().getNodeTypeIds())
                .containsExactly("application.component");
        assertThat(reloaded.hasRelationship("business.interface", "serves", "business.actor")).isTrue();
    }

    @Test
    void raisesConflict_whenTargetLayerAlreadyHasSameNamedType() {
        SchemaGraph graph = SpecFixture.at(specRoot)
                .standardModel()
                .nodeType("business", "interface", "A channel through which business services are offered", "name")
                .load();

        assertThatThrownBy(() -> planner.plan(graph, plainItem, ActionKind.MOVE,
                "Move node type application.interface to layer business"))
                .isInstanceOf(ActionConflictException.class)
                .hasMessageContaining("business.interface");
    }

    @Test
    void raisesConflict_whenUnparseableSchemaSitsAtMoveTarget() {
        SpecFixture fixture = SpecFixture.at(specRoot).standardModel();
        fixture.write(fixture.nodePath("business", "interface"), "{ \"title\" : ");
        SchemaGraph graph = fixture.load();

        assertThat(graph.findNodeType("business.interface")).isEmpty();
        assertThatThrownBy(() -> planner.plan(graph, plainItem, ActionKind.MOVE,
                "Move node type application.interface to layer business"))
                .isInstanceOf(ActionConflictException.class)
                .hasMessageContaining("interface.node.schema.json already exists");
        assertThat(SpecFixture.read(fixture.nodePath("business", "interface"))).isEqualTo("{ \"title\" : ");
        assertThat(fixture.nodePath("application", "interface")).exists();
    }

    @Test
    void reportsAlreadyImplemented_whenNodeTypeIsInTargetLayer() {
        SchemaGraph graph = SpecFixture.at(specRoot).standardModel().load();

        RemediationPlan plan = planner.plan(graph, plainItem, ActionKind.MOVE,
                "Move node type business.actor to layer business");

        assertThat(plan.getDisposition()).isEqualTo(Disposition.ALREADY_IMPLEMENTED);
        assertThat(plan.getTransaction()).isNull();
    }

    @Test
    void collapsesNodeTypeIntoEnumValue_droppingRelationshipsThatWouldDuplicate() {
        SpecFixture fixture = SpecFixture.at(specRoot)
                .predicates("references")
                .layer("data", 5)
                .nodeType("data", "customerOrder", "A purchase placed by a customer", "name")
                .nodeType("data", "customerOrders", "A purchase placed by a customer", "name")
                .nodeType("data", "invoice", "Billing document sent after delivery", "name")
                .relationship("data.invoice", "references", "data.customerOrder")
                .relationship("data.invoice", "references", "data.customerOrders");
        SchemaGraph graph = fixture.load();

        RemediationPlan plan = planner.plan(graph, plainItem, ActionKind.ENUM_COLLAPSE,
                "Collapse node type data.customerOrders into data.customerOrder as an enum value of attribute 'kind'");
        plan.getTransaction().apply(writer);

        SchemaGraph reloaded = fixture.load();
        assertThat(reloaded.findNodeType("data.customerOrders")).isEmpty();
        assertThat(reloaded.getRelationships()).singleElement()
                .satisfies(rel -> assertThat(rel.getId()).isEqualTo("data.invoice.references.data.customerOrder"));
        NodeType target = reloaded.findNodeType("data.customerOrder").orElseThrow();
        assertThat(target.findAttribute("kind").orElseThrow().getEnumValues())
                .isEqualTo(List.of("customerOrder", "customerOrders"));
    }

    @Test
    void updatesDescription_whenNewTextIsQuoted() {
        SpecFixture fixture = SpecFixture.at(specRoot).standardModel();
        SchemaGraph graph = fixture.load();

        RemediationPlan plan = planner.plan(graph, plainItem, ActionKind.CLARIFY,
                "Set description of business.event to \"A state change that triggers business processes\"");
        plan.getTransaction().apply(writer);

        assertThat(fixture.load().findNodeType("business.event").orElseThrow().getDescription())
                .isEqualTo("A state change that triggers business processes");
    }

    @Test
    void defersClarification_withoutReplacementText() {
        SchemaGraph graph = SpecFixture.at(specRoot).standardModel().load();

        RemediationPlan plan = planner.plan(graph, plainItem, ActionKind.CLARIFY,
                "Clarify description of business.event");

        assertThat(plan.getDisposition()).isEqualTo(Disposition.DEFERRED);
    }

    @Test
    void addsAttribute_orReportsItAlreadyPresent() {
        SpecFixture fixture = SpecFixture.at(specRoot).standardModel();
        SchemaGraph graph = fixture.load();

        RemediationPlan added = planner.plan(graph, plainItem, ActionKind.ADD_ATTRIBUTE,
                "Add attribute 'owner' of type 'string' to business.actor");
        RemediationPlan present = planner.plan(graph, plainItem, ActionKind.ADD_ATTRIBUTE,
                "Add attribute 'name' to business.actor");
        added.getTransaction().apply(writer);

        assertThat(present.getDisposition()).isEqualTo(Disposition.ALREADY_IMPLEMENTED);
        AttributeDefinition owner = fixture.load().findNodeType("business.actor").orElseThrow()
                .findAttribute("owner").orElseThrow();
        assertThat(owner.getType()).isEqualTo("string");
    }

    @Test
    void createsRelationshipSchema_underSourceLayer() {
        SpecFixture fixture = SpecFixture.at(specRoot).standardModel();
        SchemaGraph graph = fixture.load();

        RemediationPlan plan = planner.plan(graph, plainItem, ActionKind.CREATE_RELATIONSHIP,
                "Create relationship business.event triggers business.process");
        plan.getTransaction().apply(writer);

        assertThat(fixture.relationshipPath("business.event", "triggers", "business.process")).exists();
        SchemaGraph reloaded = fixture.load();
        assertThat(reloaded.hasRelationship("business.event", "triggers", "business.process")).isTrue();
        assertThat(reloaded.getLoadIssues()).isEmpty();
    }

    @Test
    void reportsExistingRelationship_asAlreadyImplemented() {
        SchemaGraph graph = SpecFixture.at(specRoot).standardModel().load();

        RemediationPlan plan = planner.plan(graph, plainItem, ActionKind.CREATE_RELATIONSHIP,
                "Create relationship business.actor assigned-to business.role");

        assertThat(plan.getDisposition()).isEqualTo(Disposition.ALREADY_IMPLEMENTED);
    }

    @Test
    void rejectsRelationship_withPredicateOutsideCatalog() {
        SchemaGraph graph = SpecFixture.at(specRoot).standardModel().load();

        assertThatThrownBy(() -> planner.plan(graph, plainItem, ActionKind.CREATE_RELATIONSHIP,
                "Create relationship business.actor owns business.event"))
                .isInstanceOf(ActionConflictException.class)
                .hasMessageContaining("owns");
    }

    @Test
    void removesDuplicateRelationship_keepingItsSurvivor() {
        SpecFixture fixture = duplicates();
        SchemaGraph graph = fixture.load();
        ResolutionQueueItem item = duplicateItem("application.component.depends-on.application.interface");

        RemediationPlan plan = planner.plan(graph, item, ActionKind.REMOVE_DUPLICATE, item.getPrimarySuggestion());
        plan.getTransaction().apply(writer);

        assertThat(fixture.relationshipPath("application.component", "uses", "application.interface")).doesNotExist();
        assertThat(fixture.relationshipPath("application.component", "depends-on", "application.interface")).exists();
    }

    @Test
    void raisesConflict_whenSurvivingDuplicateIsGone() {
        SchemaGraph graph = duplicates().load();
        ResolutionQueueItem item = duplicateItem("application.component.relies-on.application.interface");

        assertThatThrownBy(() -> planner.plan(graph, item, ActionKind.REMOVE_DUPLICATE, item.getPrimarySuggestion()))
                .isInstanceOf(ActionConflictException.class)
                .hasMessageContaining("would drop both duplicates");
    }

    @Test
    void removesNodeType_withDependentRelationships() {
        SpecFixture fixture = SpecFixture.at(specRoot)
                .standardModel()
                .relationship("business.event", "triggers", "business.process");
        SchemaGraph graph = fixture.load();

        RemediationPlan plan = planner.plan(graph, plainItem, ActionKind.REMOVE, "Delete node type business.event");
        plan.getTransaction().apply(writer);

        assertThat(fixture.nodePath("business", "event")).doesNotExist();
        assertThat(fixture.relationshipPath("business.event", "triggers", "business.process")).doesNotExist();
        assertThat(Files.exists(fixture.nodePath("business", "process"))).isTrue();
    }

    @Test
    void defersSuggestionsWithoutMechanicalAction() {
        SchemaGraph graph = SpecFixture.at(specRoot).standardModel().load();

        assertThat(planner.plan(graph, plainItem, ActionKind.OTHER, "Review relationships of business.actor")
                .getDisposition()).isEqualTo(Disposition.DEFERRED);
        assertThat(planner.plan(graph, plainItem, ActionKind.REMOVE, "Remove everything")
                .getDisposition()).isEqualTo(Disposition.DEFERRED);
    }

    private SpecFixture duplicates() {
        return SpecFixture.at(specRoot)
                .predicates("uses", "depends-on")
                .layer("application", 4)
                .nodeType("application", "component", "An encapsulation of application functionality", "name")
                .nodeType("application", "interface", "A point of access to application services", "name")
                .relationship("application.component", "uses", "application.interface")
                .relationship("application.component", "depends-on", "application.interface");
    }

    private static ResolutionQueueItem duplicateItem(String survivor) {
        DuplicateCandidate duplicate = DuplicateCandidate.builder()
                .sourceNodeType("application.component")
                .destinationNodeType("application.interface")
                .relationshipA(survivor)
                .relationshipB("application.component.uses.application.interface")
                .predicateA("depends-on")
                .predicateB("uses")
                .confidence(Confidence.HIGH)
                .alignmentScore(25)
                .build();
        return ResolutionQueueItem.builder()
                .position(1)
                .finding(duplicate)
                .primarySuggestion(duplicate.getSuggestion())
                .build();
    }
}
