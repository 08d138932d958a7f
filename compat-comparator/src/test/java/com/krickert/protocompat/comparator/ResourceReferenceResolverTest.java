package com.krickert.protocompat.comparator;

import com.krickert.protocompat.model.finding.ChangeType;
import com.krickert.protocompat.model.finding.Finding;
import com.krickert.protocompat.model.finding.FindingCategory;
import com.krickert.protocompat.model.finding.FindingContainer;
import com.krickert.protocompat.model.resource.InMemoryResourceDatabase;
import com.krickert.protocompat.model.resource.ResourceDatabase;
import com.krickert.protocompat.model.resource.ResourceDefinition;
import com.krickert.protocompat.model.resource.ResourceReference;
import com.krickert.protocompat.model.view.FieldView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResourceReferenceResolverTest {

    private static final String SHELF_TYPE = "example.googleapis.com/Shelf";
    private static final String BOOK_TYPE = "example.googleapis.com/Book";
    private static final ResourceDefinition SHELF = new ResourceDefinition(SHELF_TYPE, List.of("shelves/{shelf}"));
    private static final ResourceDefinition BOOK = new ResourceDefinition(BOOK_TYPE, List.of("shelves/{shelf}/books/{book}"));

    @Mock
    private ResourceDatabase originalDatabase;

    @Mock
    private ResourceDatabase updatedDatabase;

    private ResourceReferenceResolver resolver;
    private FindingContainer findings;

    @BeforeEach
    void setUp() {
        resolver = new ResourceReferenceResolver();
        findings = new FindingContainer();
    }

    private static FieldView.FieldViewBuilder field(ResourceReference reference, ResourceDatabase database) {
        return FieldView.builder()
                .name("parent")
                .number(1)
                .protoType("TYPE_STRING")
                .resourceReference(reference)
                .resourceDatabase(database)
                .file("library.proto")
                .line(20);
    }

    private Finding onlyFinding() {
        assertThat(findings.getFindings()).hasSize(1);
        return findings.getFindings().get(0);
    }

    @Test
    void noReferencesNoFindings() {
        resolver.compare(field(null, originalDatabase).build(), field(null, updatedDatabase).build(), findings);

        assertThat(findings.isEmpty()).isTrue();
        verifyNoInteractions(originalDatabase, updatedDatabase);
    }

    @Test
    void registeredTypeAdditionIsMinor() {
        when(updatedDatabase.getResourceByType(SHELF_TYPE)).thenReturn(Set.of(SHELF));

        resolver.compare(field(null, originalDatabase).build(),
                field(ResourceReference.ofType(SHELF_TYPE), updatedDatabase).build(), findings);

        Finding finding = onlyFinding();
        assertThat(finding.category()).isEqualTo(FindingCategory.RESOURCE_REFERENCE_ADDITION);
        assertThat(finding.severity()).isEqualTo(ChangeType.MINOR);
        assertThat(finding.message()).isEqualTo("A resource reference option is added to the field `parent`.");
        verifyNoInteractions(originalDatabase);
    }

    @Test
    void unregisteredTypeAdditionIsMajor() {
        when(updatedDatabase.getResourceByType(SHELF_TYPE)).thenReturn(Set.of());

        resolver.compare(field(null, originalDatabase).build(),
                field(ResourceReference.ofType(SHELF_TYPE), updatedDatabase).build(), findings);

        Finding finding = onlyFinding();
        assertThat(finding.severity()).isEqualTo(ChangeType.MAJOR);
        assertThat(finding.message())
                .isEqualTo("A resource reference option is added to the field `parent`, but it is not defined anywhere.");
    }

    @Test
    void childTypeAdditionResolvesThroughParentLookup() {
        when(updatedDatabase.getParentResourcesByChildType(BOOK_TYPE)).thenReturn(Set.of(SHELF));

        resolver.compare(field(null, originalDatabase).build(),
                field(ResourceReference.ofChildType(BOOK_TYPE), updatedDatabase).build(), findings);

        assertThat(onlyFinding().severity()).isEqualTo(ChangeType.MINOR);
        verify(updatedDatabase, never()).getResourceByType(any());
    }

    @Test
    void removalIsMajorAtOriginalLocation() {
        FieldView original = field(ResourceReference.ofType(SHELF_TYPE), originalDatabase).file("old.proto").line(3).build();

        resolver.compare(original, field(null, updatedDatabase).build(), findings);

        Finding finding = onlyFinding();
        assertThat(finding.category()).isEqualTo(FindingCategory.RESOURCE_REFERENCE_REMOVAL);
        assertThat(finding.severity()).isEqualTo(ChangeType.MAJOR);
        assertThat(finding.message()).isEqualTo("A resource reference option of the field `parent` is removed.");
        assertThat(finding.file()).isEqualTo("old.proto");
        assertThat(finding.line()).isEqualTo(3);
    }

    @Test
    void removalMovedToMessageOptionsIsMinor() {
        FieldView original = field(ResourceReference.ofType(SHELF_TYPE), originalDatabase).build();
        FieldView updated = field(null, updatedDatabase).messageResource(SHELF).build();

        resolver.compare(original, updated, findings);

        Finding finding = onlyFinding();
        assertThat(finding.severity()).isEqualTo(ChangeType.MINOR);
        assertThat(finding.message())
                .isEqualTo("A resource reference option of the field `parent` is removed, but added back to the message options.");
    }

    @Test
    void childTypeRemovalMovedToParentMessageResourceIsMinor() {
        when(originalDatabase.getParentResourcesByChildType(BOOK_TYPE)).thenReturn(Set.of(SHELF));
        FieldView original = field(ResourceReference.ofChildType(BOOK_TYPE), originalDatabase).build();
        FieldView updated = field(null, updatedDatabase).messageResource(SHELF).build();

        resolver.compare(original, updated, findings);

        assertThat(onlyFinding().severity()).isEqualTo(ChangeType.MINOR);
        verifyNoInteractions(updatedDatabase);
    }

    @Test
    void removalWithUnrelatedMessageResourceIsMajor() {
        FieldView original = field(ResourceReference.ofType(SHELF_TYPE), originalDatabase).build();
        FieldView updated = field(null, updatedDatabase).messageResource(BOOK).build();

        resolver.compare(original, updated, findings);

        assertThat(onlyFinding().severity()).isEqualTo(ChangeType.MAJOR);
    }

    @Test
    void sameKindTypeChangeIsMajor() {
        resolver.compare(field(ResourceReference.ofType(SHELF_TYPE), originalDatabase).build(),
                field(ResourceReference.ofType(BOOK_TYPE), updatedDatabase).build(), findings);

        Finding finding = onlyFinding();
        assertThat(finding.category()).isEqualTo(FindingCategory.RESOURCE_REFERENCE_CHANGE);
        assertThat(finding.message()).isEqualTo("The type of resource reference option of the field `parent` is changed "
                + "from `example.googleapis.com/Shelf` to `example.googleapis.com/Book`.");
    }

    @Test
    void unchangedReferenceProducesNothing() {
        resolver.compare(field(ResourceReference.ofChildType(BOOK_TYPE), originalDatabase).build(),
                field(ResourceReference.ofChildType(BOOK_TYPE), updatedDatabase).build(), findings);

        assertThat(findings.isEmpty()).isTrue();
        verifyNoInteractions(originalDatabase, updatedDatabase);
    }

    @Test
    void childTypeToEquivalentTypeIsNotBreaking() {
        when(originalDatabase.getParentResourcesByChildType(BOOK_TYPE)).thenReturn(Set.of(SHELF));

        resolver.compare(field(ResourceReference.ofChildType(BOOK_TYPE), originalDatabase).build(),
                field(ResourceReference.ofType(SHELF_TYPE), updatedDatabase).build(), findings);

        assertThat(findings.isEmpty()).isTrue();
        verifyNoInteractions(updatedDatabase);
    }

    @Test
    void typeToEquivalentChildTypeUsesUpdatedDatabase() {
        when(updatedDatabase.getParentResourcesByChildType(BOOK_TYPE)).thenReturn(Set.of(SHELF));

        resolver.compare(field(ResourceReference.ofType(SHELF_TYPE), originalDatabase).build(),
                field(ResourceReference.ofChildType(BOOK_TYPE), updatedDatabase).build(), findings);

        assertThat(findings.isEmpty()).isTrue();
        verifyNoInteractions(originalDatabase);
    }

    @Test
    void unresolvableFlipIsMajor() {
        when(originalDatabase.getParentResourcesByChildType(BOOK_TYPE)).thenReturn(Set.of());

        resolver.compare(field(ResourceReference.ofChildType(BOOK_TYPE), originalDatabase).build(),
                field(ResourceReference.ofType(SHELF_TYPE), updatedDatabase).build(), findings);

        Finding finding = onlyFinding();
        assertThat(finding.category()).isEqualTo(FindingCategory.RESOURCE_REFERENCE_CHANGE);
        assertThat(finding.severity()).isEqualTo(ChangeType.MAJOR);
        assertThat(finding.message()).isEqualTo("The child_type `example.googleapis.com/Book` and type "
                + "`example.googleapis.com/Shelf` of resource reference option in field `parent` cannot be resolved "
                + "to the identical resource.");
    }

    @Test
    void missingDatabaseBehavesAsEmpty() {
        resolver.compare(field(null, null).build(),
                field(ResourceReference.ofType(SHELF_TYPE), null).build(), findings);

        assertThat(onlyFinding().severity()).isEqualTo(ChangeType.MAJOR);
    }

    @Test
    void worksAgainstRealDatabase() {
        InMemoryResourceDatabase database = InMemoryResourceDatabase.builder().register(SHELF).register(BOOK).build();

        resolver.compare(field(ResourceReference.ofType(SHELF_TYPE), database).build(),
                field(ResourceReference.ofChildType(BOOK_TYPE), database).build(), findings);

        assertThat(findings.isEmpty()).isTrue();
    }

    @Test
    void malformedReferenceIsRejected() {
        FieldView malformed = field(new ResourceReference(null, null), originalDatabase).name("shelf").build();

        assertThatThrownBy(() -> resolver.compare(malformed, field(null, updatedDatabase).build(), findings))
                .isInstanceOf(MalformedResourceReferenceException.class)
                .hasMessageContaining("either `type` or `child_type` should be defined")
                .extracting(e -> ((MalformedResourceReferenceException) e).getFieldName())
                .isEqualTo("shelf");
        assertThat(findings.isEmpty()).isTrue();
    }

    @Test
    void malformedUpdatedReferenceIsRejected() {
        FieldView malformed = field(new ResourceReference("", ""), updatedDatabase).build();

        assertThatThrownBy(() -> resolver.compare(field(null, originalDatabase).build(), malformed, findings))
                .isInstanceOf(MalformedResourceReferenceException.class);
    }
}
