package com.github.provjsonld.core;

import static com.github.provjsonld.core.TestUtils.find;
import static com.github.provjsonld.core.TestUtils.fixture;
import static com.github.provjsonld.core.TestUtils.json;

import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.Test;

import com.github.provjsonld.core.ProvJsonLdError.Error;

public class RelationMappingTest {

    @Test
    public void everyKindRenamesItsRoles() throws Exception {
        final List<Object> graph = ProvJsonLdProcessor.convert(fixture("workflow.json")).getGraph();

        Assert.assertEquals(json("{'@type':'prov:Generation','@id':'_:gen1','entity':'ex:report',"
                + "'activity':'ex:analyse','time':'2024-03-01T11:00:00Z'}"), find(graph, "_:gen1"));
        Assert.assertEquals(json("{'@type':'prov:Usage','@id':'_:use1','entity':'ex:dataset',"
                + "'activity':'ex:analyse','prov:role':{'@value':'ex:input',"
                + "'@type':'prov:QUALIFIED_NAME'}}"), find(graph, "_:use1"));
        Assert.assertEquals(json("{'@type':'prov:Communication','@id':'_:com1',"
                + "'informed':'ex:publish','informant':'ex:analyse'}"), find(graph, "_:com1"));
        Assert.assertEquals(json("{'@type':'prov:Start','@id':'_:start1','activity':'ex:analyse',"
                + "'trigger':'ex:dataset','starter':'ex:publish','time':'2024-03-01T10:00:00Z'}"),
                find(graph, "_:start1"));
        Assert.assertEquals(json("{'@type':'prov:End','@id':'_:end1','activity':'ex:analyse',"
                + "'trigger':'ex:report','ender':'ex:publish','time':'2024-03-01T11:30:00Z'}"),
                find(graph, "_:end1"));
        Assert.assertEquals(json("{'@type':'prov:Invalidation','@id':'_:inv1',"
                + "'entity':'ex:reportDraft','activity':'ex:publish',"
                + "'time':'2024-03-02T09:00:00Z'}"), find(graph, "_:inv1"));
        Assert.assertEquals(json("{'@type':'prov:Derivation','@id':'_:der1',"
                + "'generatedEntity':'ex:report','usedEntity':'ex:dataset',"
                + "'activity':'ex:analyse','generation':'_:gen1','usage':'_:use1'}"),
                find(graph, "_:der1"));
        Assert.assertEquals(json("{'@type':'prov:Attribution','@id':'_:attr1',"
                + "'entity':'ex:report','agent':'ex:alice'}"), find(graph, "_:attr1"));
        Assert.assertEquals(json("{'@type':'prov:Association','@id':'_:assoc1',"
                + "'activity':'ex:analyse','agent':'ex:alice','plan':'ex:script'}"),
                find(graph, "_:assoc1"));
        Assert.assertEquals(json("{'@type':'prov:Delegation','@id':'_:del1',"
                + "'delegate':'ex:alice','responsible':'ex:lab','activity':'ex:analyse'}"),
                find(graph, "_:del1"));
        Assert.assertEquals(json("{'@type':'prov:Influence','@id':'_:inf1',"
                + "'influencee':'ex:report','influencer':'ex:lab'}"), find(graph, "_:inf1"));
        Assert.assertEquals(json("{'@type':'provext:Specialization','@id':'_:spec1',"
                + "'specificEntity':'ex:reportV2','generalEntity':'ex:report'}"),
                find(graph, "_:spec1"));
        Assert.assertEquals(json("{'@type':'provext:Alternate','@id':'_:alt1',"
                + "'alternate1':'ex:reportV2','alternate2':'ex:reportDraft'}"),
                find(graph, "_:alt1"));
        Assert.assertEquals(json("{'@type':'provext:Membership','@id':'_:mem1',"
                + "'collection':'ex:dataset','entity':'ex:row1'}"), find(graph, "_:mem1"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void noQualifiedRoleKeyIsLeft() throws Exception {
        final List<Object> graph = ProvJsonLdProcessor.convert(fixture("workflow.json")).getGraph();

        for (final Object object : graph) {
            for (final String key : ((Map<String, Object>) object).keySet()) {
                Assert.assertFalse(key, RelationKind.isRoleKey(key));
            }
        }
    }

    @Test
    public void rolesComeFirstInTableOrder() throws Exception {
        final Map<String, Object> link = find(ProvJsonLdProcessor.convert(json("{"
                + "'prefix':{'ex':'http://example.org/'},"
                + "'wasAssociatedWith':{'_:a':{'ex:note':'n','prov:plan':'ex:p',"
                + "'prov:agent':'ex:ag','prov:activity':'ex:act'}}}")).getGraph(), "_:a");

        Assert.assertEquals("[@type, @id, activity, agent, plan, ex:note]",
                link.keySet().toString());
    }

    @Test
    public void attributeNamedLikeARoleIsDropped() throws Exception {
        final ConversionResult result = ProvJsonLdProcessor.convert(json("{"
                + "'prefix':{'ex':'http://example.org/','default':'http://example.org/'},"
                + "'wasGeneratedBy':{'_:g':{'prov:entity':'ex:e','entity':'ex:other'}}}"));

        Assert.assertEquals(json("{'@type':'prov:Generation','@id':'_:g','entity':'ex:e'}"),
                find(result.getGraph(), "_:g"));
        Assert.assertEquals(1, result.getWarnings().size());
        Assert.assertEquals(Error.ATTRIBUTE_COLLISION, result.getWarnings().get(0).getType());
        Assert.assertEquals("entity", result.getWarnings().get(0).getPath().getField());
    }

    @Test
    public void nullRoleIsOmitted() throws Exception {
        final Map<String, Object> link = find(ProvJsonLdProcessor.convert(json("{"
                + "'prefix':{'ex':'http://example.org/'},"
                + "'wasDerivedFrom':{'_:d':{'prov:generatedEntity':'ex:b','prov:usedEntity':'ex:a',"
                + "'prov:activity':null}}}")).getGraph(), "_:d");

        Assert.assertFalse(link.containsKey("activity"));
        Assert.assertEquals("ex:a", link.get("usedEntity"));
    }

    @Test
    public void timeRoleKeepsAnExplicitDatatype() throws Exception {
        final Map<String, Object> link = find(ProvJsonLdProcessor.convert(json("{"
                + "'prefix':{'ex':'http://example.org/'},"
                + "'used':{'_:u':{'prov:activity':'ex:a','prov:entity':'ex:e',"
                + "'prov:time':{'$':'2024-01-01T00:00:00Z','type':'xsd:dateTime'}}}}")).getGraph(),
                "_:u");

        Assert.assertEquals(json("{'@value':'2024-01-01T00:00:00Z','@type':'xsd:dateTime'}"),
                link.get("time"));
    }

    @Test
    public void kindTables() {
        Assert.assertEquals(14, RelationKind.values().length);
        Assert.assertSame(RelationKind.WAS_DERIVED_FROM, RelationKind.forKey("wasDerivedFrom"));
        Assert.assertNull(RelationKind.forKey("wasSomethingElse"));
        Assert.assertEquals("usedEntity", RelationKind.WAS_DERIVED_FROM.renameRole("prov:usedEntity"));
        Assert.assertNull(RelationKind.USED.renameRole("prov:agent"));
        Assert.assertTrue(RelationKind.isRoleKey("prov:informant"));
        Assert.assertFalse(RelationKind.isRoleKey("prov:label"));
        Assert.assertSame(ElementKind.AGENT, ElementKind.forKey("agent"));
        Assert.assertEquals("prov:Activity", ElementKind.ACTIVITY.getType());
    }
}
